package com.causaltest.dag.engine;

import com.causaltest.dag.api.NoAdjustmentSetException;
import com.causaltest.dag.api.UnknownNodeException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Derived graphs used to identify covariate adjustment sets.
 *
 * <p>
 * Every method is a pure function of its arguments: derived graphs are built on
 * copies and the input graph is never mutated.
 *
 * <p>
 * Reference: van der Zander, Liskiewicz and Textor, "Separators and adjustment
 * sets in causal graphs: Complete criteria and an algorithmic framework" (2019),
 * Definition 3.
 */
@Log4j2
public final class Backdoor {
    private Backdoor() {
        // Utility class
    }

    /**
     * The backdoor graph of {@code graph} for {@code treatments}: a copy with
     * every edge leaving a treatment deleted.
     */
    public static DirectedGraph backdoorGraph(DirectedGraph graph, Collection<String> treatments) {
        DirectedGraph backdoor = graph.copy();
        backdoor.removeEdges(graph.outEdges(treatments));
        return backdoor;
    }

    /**
     * Nodes lying on a proper causal path from the treatments to the outcomes.
     * <p>
     * PCP(X, Y) = (De(X) \ X) ∩ An_B(Y), where De is taken in {@code graph} and
     * An_B in the backdoor graph of {@code treatments}. Ancestors exclude the
     * outcomes themselves.
     *
     * @throws NoAdjustmentSetException if either set is empty.
     * @throws UnknownNodeException     if a name is not a node of {@code graph}.
     */
    public static Set<String> properCausalPathway(DirectedGraph graph, Collection<String> treatments,
            Collection<String> outcomes) {
        requireNonEmpty(treatments, outcomes);
        requireNodes(graph, treatments, outcomes);

        Set<String> descendants = graph.descendants(treatments);
        descendants.removeAll(treatments);
        if (descendants.isEmpty())
            return descendants;

        DirectedGraph backdoor = backdoorGraph(graph, treatments);
        Set<String> outcomeAncestors = backdoor.ancestors(outcomes);
        descendants.retainAll(outcomeAncestors);
        return descendants;
    }

    /**
     * The proper backdoor graph: a copy of {@code graph} with the first edge of
     * every proper causal path from the treatments to the outcomes removed.
     * <p>
     * Those first edges are the treatment edges into a pathway node, plus the
     * treatment edges straight into an outcome.
     *
     * @throws UnknownNodeException naming the first treatment, then outcome, that
     *                              is missing from {@code graph}.
     */
    public static DirectedGraph properBackdoorGraph(DirectedGraph graph, Collection<String> treatments,
            Collection<String> outcomes) {
        requireNodes(graph, treatments, outcomes);
        requireNonEmpty(treatments, outcomes);

        DirectedGraph proper = graph.copy();
        Set<String> pathway = properCausalPathway(proper, treatments, outcomes);
        Set<String> outcomeSet = new HashSet<>(outcomes);

        List<Edge> firstEdges = new ArrayList<>();
        for (Edge e : proper.outEdges(treatments))
            if (pathway.contains(e.target()) || outcomeSet.contains(e.target()))
                firstEdges.add(e);
        proper.removeEdges(firstEdges);

        log.debug("Proper backdoor graph for {} -> {}: pathway={}, removed={}", treatments, outcomes, pathway,
                firstEdges);
        return proper;
    }

    /**
     * Nodes that may not appear in an adjustment set: every node on a proper
     * causal path (outcomes reached by a treatment included) and all of their
     * descendants. Treatments are never included.
     */
    public static Set<String> forbiddenNodes(DirectedGraph graph, Collection<String> treatments,
            Collection<String> outcomes) {
        Set<String> causal = properCausalPathway(graph, treatments, outcomes);
        Set<String> reached = graph.descendants(treatments);
        for (String o : outcomes)
            if (reached.contains(o))
                causal.add(o);
        Set<String> forbidden = new LinkedHashSet<>(causal);
        forbidden.addAll(graph.descendants(causal));
        forbidden.removeAll(treatments);
        return forbidden;
    }

    /** Fails with {@link UnknownNodeException} naming the first missing treatment, then outcome. */
    public static void requireNodes(DirectedGraph graph, Collection<String> treatments, Collection<String> outcomes) {
        for (String t : treatments)
            if (!graph.containsNode(t))
                throw new UnknownNodeException(t);
        for (String o : outcomes)
            if (!graph.containsNode(o))
                throw new UnknownNodeException(o);
    }

    private static void requireNonEmpty(Collection<String> treatments, Collection<String> outcomes) {
        if (treatments.isEmpty())
            throw new NoAdjustmentSetException("At least one treatment is required");
        if (outcomes.isEmpty())
            throw new NoAdjustmentSetException("At least one outcome is required");
    }
}
