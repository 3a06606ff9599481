package com.dashquery.variable;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the resolved bindings of every template variable for one analysis run.
 * Populated once, then sealed; read-only afterwards.
 */
public interface VariableRegistry {

    /**
     * Register variables in declaration order.
     * A later declaration of the same name replaces the earlier one.
     *
     * @param variables Variables to register
     */
    void registerAll(Collection<Variable> variables);

    /**
     * Register a single variable, replacing any previous declaration of the same name.
     */
    void register(Variable variable);

    /**
     * Supply the enumerated candidate set of a variable, used to expand an "all values" selection.
     * Takes precedence over the variable's declared options.
     *
     * @param name   Variable name
     * @param values Every candidate value
     */
    void registerCandidates(String name, List<String> values);

    /**
     * Replace the current selection of a variable.
     * Undeclared names are registered as textbox variables.
     *
     * @param name   Variable name
     * @param values New selection
     */
    void override(String name, List<String> values);

    /**
     * Seal the registry. Any later mutation fails.
     */
    void seal();

    boolean isSealed();

    /**
     * Resolve a variable to the values it substitutes.
     * An "all values" selection expands to the full candidate set, which may be empty
     * when the candidates were never enumerated.
     *
     * @param name Variable name
     * @return Values in order
     * @throws com.dashquery.exception.UnknownVariableException if the name was never declared
     */
    List<String> resolve(String name);

    /**
     * Look up a variable declaration.
     *
     * @param name Variable name
     * @return The variable, or empty if not declared
     */
    Optional<Variable> lookup(String name);

    /**
     * Candidate values known for a variable (registered candidates, else declared options).
     */
    List<String> candidates(String name);

    /**
     * Check whether a variable is declared.
     */
    default boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Names of all declared variables in registration order.
     */
    Set<String> names();
}
