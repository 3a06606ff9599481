package com.dashquery.variable;

import com.dashquery.exception.RegistrySealedException;
import com.dashquery.exception.UnknownVariableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default implementation of VariableRegistry backed by insertion-ordered maps.
 * Not thread-safe while being populated; safe for concurrent reads once sealed.
 */
public class DefaultVariableRegistry implements VariableRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultVariableRegistry.class);

    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final Map<String, List<String>> candidates = new HashMap<>();
    private volatile boolean sealed;

    @Override
    public void registerAll(Collection<Variable> toRegister) {
        if (toRegister == null) {
            return;
        }
        for (Variable variable : toRegister) {
            register(variable);
        }
    }

    @Override
    public void register(Variable variable) {
        checkNotSealed();
        if (variable == null) {
            throw new IllegalArgumentException("Variable cannot be null");
        }
        Variable previous = variables.put(variable.name(), variable);
        if (previous != null) {
            log.debug("Variable '{}' redeclared, later declaration wins", variable.name());
        }
    }

    @Override
    public void registerCandidates(String name, List<String> values) {
        checkNotSealed();
        if (!variables.containsKey(name)) {
            throw new UnknownVariableException(name);
        }
        candidates.put(name, values == null ? List.of() : List.copyOf(values));
    }

    @Override
    public void override(String name, List<String> values) {
        checkNotSealed();
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Override for '" + name + "' has no values");
        }
        Variable existing = variables.get(name);
        if (existing == null) {
            log.debug("Override for undeclared variable '{}', registering as textbox", name);
            variables.put(name, new Variable(name, VariableType.TEXTBOX, values,
                    false, null, values.size() > 1, List.of()));
        } else {
            variables.put(name, existing.withCurrentValues(values));
        }
    }

    @Override
    public void seal() {
        sealed = true;
        log.debug("Variable registry sealed with {} variables", variables.size());
    }

    @Override
    public boolean isSealed() {
        return sealed;
    }

    @Override
    public List<String> resolve(String name) {
        Variable variable = variables.get(name);
        if (variable == null) {
            throw new UnknownVariableException(name);
        }
        if (variable.isAllSelected()) {
            return candidates(name);
        }
        return variable.currentValues();
    }

    @Override
    public Optional<Variable> lookup(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    @Override
    public List<String> candidates(String name) {
        List<String> registered = candidates.get(name);
        if (registered != null) {
            return registered;
        }
        Variable variable = variables.get(name);
        if (variable == null) {
            throw new UnknownVariableException(name);
        }
        return variable.options();
    }

    @Override
    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(variables.keySet()));
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new RegistrySealedException("Variable registry is sealed for this run");
        }
    }
}
