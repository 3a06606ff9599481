package com.dashquery.variable;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of dashboard template variables.
 */
public enum VariableType {
    /**
     * Values enumerated by a datasource query.
     */
    QUERY,

    /**
     * Values declared statically as a comma-separated list.
     */
    CUSTOM,

    /**
     * Time interval values such as 1m, 1h.
     */
    INTERVAL,

    /**
     * Datasource selector.
     */
    DATASOURCE,

    /**
     * Free text entered by the viewer.
     */
    TEXTBOX,

    /**
     * Hidden constant.
     */
    CONSTANT;

    /**
     * Look up a type by its dashboard name (e.g. "query", "textbox").
     *
     * @param name Type name, case-insensitive
     * @return The type, or empty if the name is not a supported variable type
     */
    public static Optional<VariableType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(VariableType.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
