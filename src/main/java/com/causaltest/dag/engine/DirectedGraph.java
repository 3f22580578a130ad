package com.causaltest.dag.engine;

import com.causaltest.dag.api.CycleException;
import com.causaltest.dag.api.UnknownNodeException;

import java.util.*;

/**
 * Mutable directed acyclic graph over string-named nodes.
 *
 * Storage is a pair of adjacency maps, one per direction, so that both
 * descendant and ancestor queries walk only the edges they need. All maps and
 * sets preserve insertion order; every query result is therefore deterministic
 * for a given construction sequence.
 *
 * Invariant: the graph is always acyclic. {@link #addEdge(String, String)}
 * rejects an edge that would close a cycle before touching any state.
 *
 * Thread Safety:
 * Not synchronized. Concurrent readers are safe as long as no thread mutates;
 * mutations must be serialized by the caller.
 */
public final class DirectedGraph {
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
    private int edgeCount;

    public DirectedGraph() {
    }

    /** Adds a node if absent. Returns true if the node was new. */
    public boolean addNode(String node) {
        Objects.requireNonNull(node, "node");
        if (successors.containsKey(node))
            return false;
        successors.put(node, new LinkedHashSet<>());
        predecessors.put(node, new LinkedHashSet<>());
        return true;
    }

    /**
     * Inserts the edge {@code u -> v}, creating missing endpoints.
     *
     * @return true if the edge was added, false if it was already present.
     * @throws CycleException if the edge is a self-loop or {@code u} is already
     *                        reachable from {@code v}; the graph is unchanged.
     */
    public boolean addEdge(String u, String v) {
        Objects.requireNonNull(u, "u");
        Objects.requireNonNull(v, "v");
        if (u.equals(v))
            throw new CycleException("Invalid causal DAG: self-loop on " + u);
        if (containsEdge(u, v))
            return false;
        if (containsNode(u) && containsNode(v) && reaches(v, u))
            throw new CycleException("Invalid causal DAG: edge " + u + " -> " + v + " closes a cycle");

        addNode(u);
        addNode(v);
        successors.get(u).add(v);
        predecessors.get(v).add(u);
        edgeCount++;
        return true;
    }

    /** Removes the edge {@code u -> v} if present. */
    public boolean removeEdge(String u, String v) {
        Set<String> out = successors.get(u);
        if (out == null || !out.remove(v))
            return false;
        predecessors.get(v).remove(u);
        edgeCount--;
        return true;
    }

    /**
     * Bulk removal. Removing edges can never introduce a cycle, so no check is
     * performed. Edges that are not present are ignored.
     *
     * @return the number of edges actually removed.
     */
    public int removeEdges(Collection<Edge> edges) {
        int removed = 0;
        for (Edge e : edges)
            if (removeEdge(e.source(), e.target()))
                removed++;
        return removed;
    }

    public boolean containsNode(String node) {
        return successors.containsKey(node);
    }

    public boolean containsEdge(String u, String v) {
        Set<String> out = successors.get(u);
        return out != null && out.contains(v);
    }

    public int nodeCount() {
        return successors.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /** Unmodifiable view of the nodes in insertion order. */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    /** Snapshot of all edges, grouped by source in insertion order. */
    public List<Edge> edges() {
        List<Edge> out = new ArrayList<>(edgeCount);
        for (var entry : successors.entrySet())
            for (String target : entry.getValue())
                out.add(new Edge(entry.getKey(), target));
        return out;
    }

    /** Snapshot of the edges leaving any of the given nodes. Unknown nodes are skipped. */
    public List<Edge> outEdges(Collection<String> sources) {
        List<Edge> out = new ArrayList<>();
        for (String s : new LinkedHashSet<>(sources)) {
            Set<String> targets = successors.get(s);
            if (targets == null)
                continue;
            for (String t : targets)
                out.add(new Edge(s, t));
        }
        return out;
    }

    public Set<String> children(String node) {
        return Collections.unmodifiableSet(require(successors, node));
    }

    public Set<String> parents(String node) {
        return Collections.unmodifiableSet(require(predecessors, node));
    }

    /** All nodes reachable from {@code node} along directed edges, excluding {@code node}. */
    public Set<String> descendants(String node) {
        require(successors, node);
        Set<String> out = reach(List.of(node), successors);
        out.remove(node);
        return out;
    }

    /** All nodes with a directed path into {@code node}, excluding {@code node}. */
    public Set<String> ancestors(String node) {
        require(predecessors, node);
        Set<String> out = reach(List.of(node), predecessors);
        out.remove(node);
        return out;
    }

    /** Union of {@link #descendants(String)} over {@code nodes}. */
    public Set<String> descendants(Collection<String> nodes) {
        Set<String> out = new LinkedHashSet<>();
        for (String n : nodes)
            out.addAll(descendants(n));
        return out;
    }

    /** Union of {@link #ancestors(String)} over {@code nodes}. */
    public Set<String> ancestors(Collection<String> nodes) {
        Set<String> out = new LinkedHashSet<>();
        for (String n : nodes)
            out.addAll(ancestors(n));
        return out;
    }

    /**
     * The ancestral closure of {@code nodes}: the nodes themselves plus all of
     * their ancestors.
     */
    public Set<String> ancestralSet(Collection<String> nodes) {
        for (String n : nodes)
            require(predecessors, n);
        return reach(nodes, predecessors);
    }

    /** Kahn's algorithm over the live adjacency maps. O(V+E). */
    public boolean isAcyclic() {
        Map<String, Integer> inDegree = new HashMap<>(successors.size() * 2);
        Deque<String> queue = new ArrayDeque<>();
        for (var entry : predecessors.entrySet()) {
            inDegree.put(entry.getKey(), entry.getValue().size());
            if (entry.getValue().isEmpty())
                queue.add(entry.getKey());
        }
        int visited = 0;
        while (!queue.isEmpty()) {
            String curr = queue.poll();
            visited++;
            for (String child : successors.get(curr))
                if (inDegree.merge(child, -1, Integer::sum) == 0)
                    queue.add(child);
        }
        return visited == successors.size();
    }

    /** Compiles an immutable topological snapshot of the current graph. */
    public TopologicalOrder topologicalOrder() {
        return TopologicalOrder.of(this);
    }

    /** Returns a fully independent copy; mutating it never affects this graph. */
    public DirectedGraph copy() {
        DirectedGraph g = new DirectedGraph();
        for (String n : successors.keySet())
            g.addNode(n);
        for (var entry : successors.entrySet())
            for (String target : entry.getValue())
                g.link(entry.getKey(), target);
        return g;
    }

    /**
     * Induced subgraph on {@code keep}: those nodes and every edge with both
     * endpoints in it. Unknown names are ignored.
     */
    public DirectedGraph subgraph(Collection<String> keep) {
        Set<String> kept = new HashSet<>(keep);
        DirectedGraph g = new DirectedGraph();
        for (String n : successors.keySet())
            if (kept.contains(n))
                g.addNode(n);
        for (String n : g.nodes())
            for (String target : successors.get(n))
                if (kept.contains(target))
                    g.link(n, target);
        return g;
    }

    // Copying from an acyclic graph cannot create a cycle, so the reachability
    // check in addEdge is skipped.
    private void link(String u, String v) {
        successors.get(u).add(v);
        predecessors.get(v).add(u);
        edgeCount++;
    }

    private boolean reaches(String from, String to) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            String curr = stack.pop();
            if (curr.equals(to))
                return true;
            if (seen.add(curr))
                for (String next : successors.get(curr))
                    stack.push(next);
        }
        return false;
    }

    private static Set<String> reach(Collection<String> start, Map<String, Set<String>> adjacency) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String s : start)
            if (seen.add(s))
                queue.add(s);
        while (!queue.isEmpty()) {
            for (String next : adjacency.get(queue.poll()))
                if (seen.add(next))
                    queue.add(next);
        }
        return seen;
    }

    private static Set<String> require(Map<String, Set<String>> adjacency, String node) {
        Set<String> s = adjacency.get(node);
        if (s == null)
            throw new UnknownNodeException(node);
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DirectedGraph other))
            return false;
        return successors.equals(other.successors);
    }

    @Override
    public int hashCode() {
        return successors.hashCode();
    }

    @Override
    public String toString() {
        return "Nodes: " + successors.keySet() + "\nEdges: " + edges();
    }
}
