package com.causaltest.dag;

import com.causaltest.dag.api.CycleException;
import com.causaltest.dag.api.NoAdjustmentSetException;
import com.causaltest.dag.api.UnknownNodeException;
import com.causaltest.dag.engine.Backdoor;
import com.causaltest.dag.engine.DSeparation;
import com.causaltest.dag.engine.DirectedGraph;
import com.causaltest.dag.engine.Edge;
import com.causaltest.dag.engine.TopologicalOrder;
import com.causaltest.dag.io.DotParser;
import com.causaltest.dag.io.DotWriter;
import com.causaltest.dag.io.GraphDefinition;
import com.causaltest.dag.io.JsonGraphCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A causal DAG: nodes are random variables and an edge {@code A -> B} states
 * that A causes B.
 * <p>
 * This is the entry point for adjustment queries. It handles:
 * <ul>
 * <li>Loading the graph from dot text, a dot file, a JSON definition or a
 * {@link GraphDefinition}</li>
 * <li>Incremental construction with cycle rejection</li>
 * <li>Backdoor, proper backdoor and proper causal pathway queries</li>
 * <li>Minimal adjustment sets for the estimators downstream</li>
 * </ul>
 * Queries take and return plain variable names. Derived graphs are returned as
 * new, independent {@code CausalDag}s.
 * <p>
 * Thread Safety: concurrent queries against an unchanging DAG are safe. Calls
 * to {@link #addEdge(String, String)} must be serialized by the caller.
 */
public final class CausalDag {
    private static final Logger log = LogManager.getLogger(CausalDag.class);

    private final DirectedGraph graph;
    private String name;

    /** Creates an empty DAG. */
    public CausalDag() {
        this(new DirectedGraph());
    }

    private CausalDag(DirectedGraph graph) {
        this.graph = graph;
    }

    /**
     * Parses dot text.
     *
     * @throws com.causaltest.dag.io.DotParseException if the text is malformed.
     * @throws CycleException                          if the graph is cyclic.
     */
    public static CausalDag fromDot(String dot) {
        return fromDefinition(DotParser.parse(dot));
    }

    /** Loads a dot file. */
    public static CausalDag fromDotFile(Path dotPath) throws IOException {
        CausalDag dag = fromDefinition(DotParser.parseFile(dotPath));
        log.info("Loaded causal DAG from {}: {} nodes, {} edges", dotPath, dag.graph.nodeCount(),
                dag.graph.edgeCount());
        return dag;
    }

    /** Loads a JSON graph definition, see {@link JsonGraphCodec}. */
    public static CausalDag fromJsonFile(Path jsonPath) throws IOException {
        CausalDag dag = fromDefinition(JsonGraphCodec.parseFile(jsonPath));
        log.info("Loaded causal DAG from {}: {} nodes, {} edges", jsonPath, dag.graph.nodeCount(),
                dag.graph.edgeCount());
        return dag;
    }

    /**
     * Builds a DAG from a definition. Nodes are added in definition order, then
     * edges.
     *
     * @throws CycleException           if the edges contain a cycle.
     * @throws IllegalArgumentException if a node or edge endpoint has no name.
     */
    public static CausalDag fromDefinition(GraphDefinition def) {
        def.validate();
        CausalDag dag = new CausalDag();
        dag.name = def.getName();
        if (def.getNodes() != null)
            for (GraphDefinition.NodeDef nd : def.getNodes())
                dag.graph.addNode(nd.getName());
        if (def.getEdges() != null) {
            for (GraphDefinition.EdgeDef ed : def.getEdges()) {
                try {
                    dag.graph.addEdge(ed.getSource(), ed.getTarget());
                } catch (CycleException e) {
                    log.error("Rejected graph definition {}: {}", def.getName(), e.getMessage());
                    throw e;
                }
            }
        }
        return dag;
    }

    /** The graph id from the source definition, or null. */
    public String name() {
        return name;
    }

    public boolean addNode(String node) {
        return graph.addNode(node);
    }

    /**
     * Adds the edge {@code u -> v}.
     *
     * @throws CycleException if the edge would create a cycle; the DAG is left
     *                        unchanged.
     */
    public boolean addEdge(String u, String v) {
        try {
            return graph.addEdge(u, v);
        } catch (CycleException e) {
            log.warn("Rejected edge {} -> {}: {}", u, v, e.getMessage());
            throw e;
        }
    }

    /** Removes the edge {@code u -> v} if present. */
    public boolean removeEdge(String u, String v) {
        return graph.removeEdge(u, v);
    }

    public boolean isAcyclic() {
        return graph.isAcyclic();
    }

    public boolean containsNode(String node) {
        return graph.containsNode(node);
    }

    public boolean containsEdge(String u, String v) {
        return graph.containsEdge(u, v);
    }

    public Set<String> nodes() {
        return graph.nodes();
    }

    public List<Edge> edges() {
        return graph.edges();
    }

    public Set<String> parents(String node) {
        return graph.parents(node);
    }

    public Set<String> children(String node) {
        return graph.children(node);
    }

    public Set<String> descendants(String node) {
        return graph.descendants(node);
    }

    public Set<String> ancestors(String node) {
        return graph.ancestors(node);
    }

    public TopologicalOrder topologicalOrder() {
        return graph.topologicalOrder();
    }

    /** Returns an independent deep copy. */
    public CausalDag copy() {
        CausalDag copy = new CausalDag(graph.copy());
        copy.name = name;
        return copy;
    }

    /** The DAG with every edge leaving a treatment removed. */
    public CausalDag backdoorGraph(Set<String> treatments) {
        Backdoor.requireNodes(graph, treatments, Set.of());
        return derived(Backdoor.backdoorGraph(graph, treatments));
    }

    /** Variables on a proper causal path from the treatments to the outcomes. */
    public Set<String> properCausalPathway(Set<String> treatments, Set<String> outcomes) {
        return Backdoor.properCausalPathway(graph, treatments, outcomes);
    }

    /**
     * The proper backdoor graph: the first edge of every proper causal path
     * from the treatments to the outcomes is removed.
     *
     * @throws UnknownNodeException if a treatment or outcome is not in the DAG.
     */
    public CausalDag properBackdoorGraph(Set<String> treatments, Set<String> outcomes) {
        return derived(Backdoor.properBackdoorGraph(graph, treatments, outcomes));
    }

    /**
     * The smallest set of variables whose adjustment blocks every backdoor path
     * between the treatments and the outcomes, with no proper subset doing the
     * same.
     *
     * @throws UnknownNodeException     if a treatment or outcome is not in the
     *                                  DAG.
     * @throws NoAdjustmentSetException if no covariate set can block the
     *                                  backdoor paths, or the query is
     *                                  degenerate.
     */
    public Set<String> minimalAdjustmentSet(Set<String> treatments, Set<String> outcomes) {
        DirectedGraph proper = Backdoor.properBackdoorGraph(graph, treatments, outcomes);
        Set<String> allowed = new LinkedHashSet<>(graph.nodes());
        allowed.removeAll(Backdoor.forbiddenNodes(graph, treatments, outcomes));

        Set<String> adjustment = DSeparation.minimalDSeparator(proper, treatments, outcomes, allowed);
        log.debug("Minimal adjustment set for {} -> {}: {}", treatments, outcomes, adjustment);
        return adjustment;
    }

    /**
     * Checks a candidate covariate set: it must avoid the treatments, the
     * outcomes and every node on or below a proper causal path, and must
     * d-separate treatments from outcomes in the proper backdoor graph.
     */
    public boolean isValidAdjustmentSet(Set<String> treatments, Set<String> outcomes, Set<String> covariates) {
        for (String c : covariates)
            if (!graph.containsNode(c))
                throw new UnknownNodeException(c);
        DirectedGraph proper = Backdoor.properBackdoorGraph(graph, treatments, outcomes);
        Set<String> forbidden = Backdoor.forbiddenNodes(graph, treatments, outcomes);
        for (String c : covariates)
            if (treatments.contains(c) || outcomes.contains(c) || forbidden.contains(c))
                return false;
        Set<String> overlap = new HashSet<>(treatments);
        overlap.retainAll(outcomes);
        if (!overlap.isEmpty())
            return false;
        return DSeparation.isDSeparated(proper, treatments, outcomes, covariates);
    }

    /**
     * Whether {@code zs} d-separates {@code xs} from {@code ys} in this DAG.
     */
    public boolean isDSeparated(Set<String> xs, Set<String> ys, Set<String> zs) {
        return DSeparation.isDSeparated(graph, xs, ys, zs);
    }

    /** Snapshot of this DAG as a definition, for serialization. */
    public GraphDefinition toDefinition() {
        GraphDefinition def = new GraphDefinition();
        def.setName(name);
        for (String n : graph.nodes())
            def.getNodes().add(new GraphDefinition.NodeDef(n));
        for (Edge e : graph.edges())
            def.getEdges().add(new GraphDefinition.EdgeDef(e.source(), e.target()));
        return def;
    }

    public String toDot() {
        return DotWriter.write(toDefinition());
    }

    private CausalDag derived(DirectedGraph derivedGraph) {
        CausalDag dag = new CausalDag(derivedGraph);
        dag.name = name;
        return dag;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CausalDag other && graph.equals(other.graph));
    }

    @Override
    public int hashCode() {
        return graph.hashCode();
    }

    /** Diagnostic form, for logging only. */
    @Override
    public String toString() {
        return graph.toString();
    }
}
