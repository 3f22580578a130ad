package com.causaltest.dag.api;

/**
 * Thrown when an edge insertion, or the initial load of a graph definition,
 * would leave the causal graph with a directed cycle.
 *
 * The graph that rejected the change is left in its prior, acyclic state.
 */
public class CycleException extends IllegalStateException {

    public CycleException(String message) {
        super(message);
    }
}
