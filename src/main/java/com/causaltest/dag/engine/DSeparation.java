package com.causaltest.dag.engine;

import com.causaltest.dag.api.NoAdjustmentSetException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * d-separation queries over a {@link DirectedGraph}.
 *
 * Both the test and the separator search use the moralised ancestral graph
 * criterion (Lauritzen et al. 1990): X and Y are d-separated by Z iff Z
 * separates X from Y in the moral graph of the subgraph induced by
 * An(X ∪ Y ∪ Z).
 *
 * The separator search is FindMinSep from van der Zander, Liskiewicz and Textor
 * (2019), after Tian, Paz and Pearl (1998). It returns a minimal separator: no
 * proper subset also separates. Among several minimal separators the one that
 * borders the connected region of X in the moral graph is returned.
 */
@Log4j2
public final class DSeparation {
    private DSeparation() {
        // Utility class
    }

    /**
     * Tests whether {@code zs} d-separates {@code xs} from {@code ys}.
     *
     * @throws IllegalArgumentException if the three sets are not pairwise
     *                                  disjoint.
     */
    public static boolean isDSeparated(DirectedGraph graph, Collection<String> xs, Collection<String> ys,
            Collection<String> zs) {
        requireDisjoint(xs, ys, "X", "Y");
        requireDisjoint(xs, zs, "X", "Z");
        requireDisjoint(ys, zs, "Y", "Z");

        Set<String> relevant = new LinkedHashSet<>(xs);
        relevant.addAll(ys);
        relevant.addAll(zs);
        Map<String, Set<String>> moral = moralize(graph, graph.ancestralSet(relevant));
        return !connected(moral, xs, new HashSet<>(ys), new HashSet<>(zs));
    }

    /**
     * Finds a minimal set of nodes, disjoint from {@code xs} and {@code ys},
     * that d-separates them.
     *
     * @see #minimalDSeparator(DirectedGraph, Collection, Collection, Collection)
     */
    public static Set<String> minimalDSeparator(DirectedGraph graph, Collection<String> xs,
            Collection<String> ys) {
        return minimalDSeparator(graph, xs, ys, graph.nodes());
    }

    /**
     * Finds a minimal d-separator of {@code xs} and {@code ys} drawn only from
     * {@code allowed}.
     *
     * @return the separator in graph insertion order; empty when X and Y are
     *         already d-separated by the empty set.
     * @throws NoAdjustmentSetException if either set is empty, the sets
     *                                  overlap, or no separator exists within
     *                                  {@code allowed} (for instance X and Y are
     *                                  joined by an edge).
     */
    public static Set<String> minimalDSeparator(DirectedGraph graph, Collection<String> xs,
            Collection<String> ys, Collection<String> allowed) {
        if (xs.isEmpty() || ys.isEmpty())
            throw new NoAdjustmentSetException("Treatments and outcomes must both be non-empty");
        Set<String> overlap = new LinkedHashSet<>(xs);
        overlap.retainAll(new HashSet<>(ys));
        if (!overlap.isEmpty())
            throw new NoAdjustmentSetException("Treatments and outcomes overlap: " + overlap);

        Set<String> endpoints = new LinkedHashSet<>(xs);
        endpoints.addAll(ys);
        Set<String> ancestral = graph.ancestralSet(endpoints);
        Map<String, Set<String>> moral = moralize(graph, ancestral);

        // The largest admissible candidate separates X and Y iff any separator does.
        Set<String> candidates = new LinkedHashSet<>(ancestral);
        candidates.retainAll(new HashSet<>(allowed));
        candidates.removeAll(endpoints);
        if (connected(moral, xs, new HashSet<>(ys), candidates))
            throw new NoAdjustmentSetException("No adjustment set exists between " + xs + " and " + ys);

        Set<String> nearX = reachedBlockers(moral, xs, candidates);
        Set<String> minimal = reachedBlockers(moral, ys, nearX);

        Set<String> ordered = new LinkedHashSet<>();
        for (String n : graph.nodes())
            if (minimal.contains(n))
                ordered.add(n);
        log.debug("Minimal separator of {} and {}: {}", xs, ys, ordered);
        return ordered;
    }

    /**
     * Moral graph of the subgraph induced by {@code keep}: parents and children
     * joined, and every pair of co-parents married. {@code keep} must be
     * ancestrally closed.
     */
    static Map<String, Set<String>> moralize(DirectedGraph graph, Set<String> keep) {
        Map<String, Set<String>> moral = new LinkedHashMap<>();
        for (String n : keep)
            moral.put(n, new LinkedHashSet<>());
        for (String child : keep) {
            List<String> parents = new ArrayList<>(graph.parents(child));
            for (int i = 0; i < parents.size(); i++) {
                String p = parents.get(i);
                link(moral, p, child);
                for (int j = i + 1; j < parents.size(); j++)
                    link(moral, p, parents.get(j));
            }
        }
        return moral;
    }

    private static boolean connected(Map<String, Set<String>> undirected, Collection<String> start,
            Set<String> targets, Set<String> blocked) {
        Set<String> seen = new HashSet<>(start);
        Deque<String> queue = new ArrayDeque<>(seen);
        while (!queue.isEmpty()) {
            for (String next : undirected.get(queue.poll())) {
                if (targets.contains(next))
                    return true;
                if (!blocked.contains(next) && seen.add(next))
                    queue.add(next);
            }
        }
        return false;
    }

    /**
     * Walks the undirected graph from {@code start}, never passing through a
     * node of {@code blockers}, and returns the blockers that were touched.
     */
    private static Set<String> reachedBlockers(Map<String, Set<String>> undirected, Collection<String> start,
            Set<String> blockers) {
        Set<String> hit = new HashSet<>();
        Set<String> seen = new HashSet<>(start);
        Deque<String> queue = new ArrayDeque<>(seen);
        while (!queue.isEmpty()) {
            for (String next : undirected.get(queue.poll())) {
                if (blockers.contains(next))
                    hit.add(next);
                else if (seen.add(next))
                    queue.add(next);
            }
        }
        return hit;
    }

    private static void link(Map<String, Set<String>> undirected, String a, String b) {
        undirected.get(a).add(b);
        undirected.get(b).add(a);
    }

    private static void requireDisjoint(Collection<String> a, Collection<String> b, String aName,
            String bName) {
        for (String n : a)
            if (b.contains(n))
                throw new IllegalArgumentException(aName + " and " + bName + " share node " + n);
    }
}
