package com.causaltest.dag.specification;

import com.causaltest.dag.CausalDag;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Pairs a {@link Scenario} with the causal DAG that the scenario's variables
 * are assumed to follow.
 */
public record CausalSpecification(Scenario scenario, CausalDag causalDag) {

    public CausalSpecification {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(causalDag, "causalDag");
    }

    /** Scenario variables that the DAG does not model. */
    public Set<String> unknownVariables() {
        Set<String> unknown = new LinkedHashSet<>();
        for (String v : scenario.variables())
            if (!causalDag.containsNode(v))
                unknown.add(v);
        return unknown;
    }

    @Override
    public String toString() {
        return "Scenario: " + scenario + "\nCausal DAG:\n" + causalDag;
    }
}
