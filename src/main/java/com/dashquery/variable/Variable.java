package com.dashquery.variable;

import java.util.List;
import java.util.Objects;

/**
 * A template variable declared by a dashboard, with its current selection.
 *
 * @param name          Variable name as referenced by $name
 * @param type          Variable kind
 * @param currentValues Selected values in declaration order; never empty
 * @param allowAll      Whether the "all values" option is offered
 * @param allValueToken Custom sentinel for the "all values" option, or null for the default
 * @param multiValue    Whether more than one value may be selected
 * @param options       Declared candidate values, excluding the all-option
 */
public record Variable(
        String name,
        VariableType type,
        List<String> currentValues,
        boolean allowAll,
        String allValueToken,
        boolean multiValue,
        List<String> options
) {
    /**
     * Selection value used for the "all values" option when no custom token is set.
     */
    public static final String DEFAULT_ALL_TOKEN = "$__all";

    public Variable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be blank");
        }
        if (currentValues == null || currentValues.isEmpty()) {
            throw new IllegalArgumentException("Variable '" + name + "' has no current value");
        }
        currentValues = List.copyOf(currentValues);
        options = options == null ? List.of() : List.copyOf(options);
    }

    /**
     * Create a single-valued variable.
     */
    public static Variable single(String name, VariableType type, String value) {
        return new Variable(name, type, List.of(value), false, null, false, List.of());
    }

    /**
     * Create a multi-valued variable.
     */
    public static Variable multi(String name, List<String> values) {
        return new Variable(name, VariableType.CUSTOM, values, false, null, true, List.of());
    }

    /**
     * The sentinel that marks an "all values" selection for this variable.
     */
    public String allSentinel() {
        return allValueToken != null && !allValueToken.isEmpty() ? allValueToken : DEFAULT_ALL_TOKEN;
    }

    /**
     * Check whether the current selection is the "all values" option.
     */
    public boolean isAllSelected() {
        if (!allowAll) {
            return false;
        }
        String sentinel = allSentinel();
        return currentValues.stream()
                .anyMatch(v -> v.equals(sentinel) || v.equals(DEFAULT_ALL_TOKEN));
    }

    /**
     * Check whether this variable substitutes as a list rather than a scalar.
     */
    public boolean isMultiValued() {
        return multiValue || currentValues.size() > 1 || isAllSelected();
    }

    /**
     * Copy of this variable with a different selection.
     */
    public Variable withCurrentValues(List<String> values) {
        return new Variable(name, type, values, allowAll, allValueToken, multiValue, options);
    }
}
