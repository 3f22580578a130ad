package com.causaltest.dag.api;

/**
 * Thrown when a variable name passed to a query is not a node of the graph.
 */
public class UnknownNodeException extends IllegalArgumentException {
    private final String nodeName;

    public UnknownNodeException(String nodeName) {
        super("Unknown node: " + nodeName);
        this.nodeName = nodeName;
    }

    /** The name that could not be resolved. */
    public String nodeName() {
        return nodeName;
    }
}
