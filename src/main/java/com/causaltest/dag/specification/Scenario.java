package com.causaltest.dag.specification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A set of constraints over a subset of the system's input variables that
 * characterises one use-case of the system under test.
 * <p>
 * Constraints are opaque here: a value, a distribution or any other object the
 * test generator understands. Later constraints replace earlier ones for the
 * same variable.
 */
public final class Scenario {
    private final Map<String, Object> constraints = new LinkedHashMap<>();

    public Scenario() {
    }

    public Scenario(Map<String, ?> constraints) {
        addConstraints(constraints);
    }

    public Scenario addConstraint(String variable, Object constraint) {
        constraints.put(variable, constraint);
        return this;
    }

    public Scenario addConstraints(Map<String, ?> more) {
        constraints.putAll(more);
        return this;
    }

    /** The constraint on {@code variable}, or null if it is unconstrained. */
    public Object constraint(String variable) {
        return constraints.get(variable);
    }

    public Set<String> variables() {
        return Collections.unmodifiableSet(constraints.keySet());
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(constraints);
    }

    @Override
    public String toString() {
        return constraints.toString();
    }
}
