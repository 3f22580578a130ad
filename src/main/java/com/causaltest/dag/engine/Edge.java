package com.causaltest.dag.engine;

import java.util.Objects;

/**
 * A directed edge {@code source -> target}, read as "source causes target".
 */
public record Edge(String source, String target) {

    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    @Override
    public String toString() {
        return "(" + source + ", " + target + ")";
    }
}
