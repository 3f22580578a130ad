package com.causaltest.dag.engine;

import com.causaltest.dag.api.CycleException;
import com.causaltest.dag.api.UnknownNodeException;

import java.util.*;

/**
 * Topology -- CSR-encoded snapshot of a causal DAG in topological order.
 *
 * Data layout:
 * - topoOrder: node names sorted so that every cause precedes its effects.
 * - childrenList: a flattened int array of the topological indices of all
 * children for all nodes.
 * - childrenOffset: childrenOffset[i] points to the start of node i's children
 * in childrenList; the children end at childrenOffset[i+1] (exclusive).
 *
 * The snapshot is immutable and detached from the graph it was built from.
 */
public final class TopologicalOrder {
    private final String[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(String[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node name at the given topological index. */
    public String node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node name to its topological index. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new UnknownNodeException(name);
        return idx;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** A root has no causes inside the graph (an exogenous variable). */
    public boolean isRoot(int ti) {
        return parentCount[ti] == 0;
    }

    /** Node names in topological order. */
    public List<String> nodes() {
        return List.of(topoOrder);
    }

    public static TopologicalOrder of(DirectedGraph graph) {
        Builder b = builder();
        for (String n : graph.nodes())
            b.addNode(n);
        for (Edge e : graph.edges())
            b.addEdge(e.source(), e.target());
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(String name) {
            if (nameToIdx.containsKey(name))
                throw new IllegalArgumentException("Duplicate node name: " + name);
            int idx = nodes.size();
            nodes.add(name);
            nameToIdx.put(name, idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new CycleException("Self-edge not allowed: " + from);
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new UnknownNodeException(name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         * Ties are broken by insertion order, so the result is deterministic.
         *
         * @throws CycleException if the edges contain a directed cycle.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Initialize queue with nodes having in-degree 0
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue (Kahn's algorithm)
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n) {
                List<String> stuck = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        stuck.add(nodes.get(i));
                throw new CycleException("Invalid causal DAG: contains a cycle through " + stuck);
            }

            // 4. Construct compact arrays
            String[] ordered = new String[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(ordered[ti], ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            return new TopologicalOrder(ordered, offsets, flatChildren, parentCounts, newNameToIndex);
        }
    }
}
