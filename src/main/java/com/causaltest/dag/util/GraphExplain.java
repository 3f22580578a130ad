package com.causaltest.dag.util;

import com.causaltest.dag.CausalDag;
import com.causaltest.dag.engine.TopologicalOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic utility for inspecting a causal DAG.
 *
 * <p>
 * This class generates human-readable string representations of the graph
 * structure and of the role each variable plays in an adjustment query.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging and reports. The
 * output format is not a machine-readable contract.
 */
public final class GraphExplain {

    /** Role of a variable in an adjustment query, used for highlighting. */
    public enum Role {
        TREATMENT, OUTCOME, ADJUSTMENT
    }

    private final CausalDag dag;
    private final TopologicalOrder topology;
    private final Map<String, Role> roles;

    public GraphExplain(CausalDag dag) {
        this(dag, Collections.emptyMap());
    }

    public GraphExplain(CausalDag dag, Map<String, Role> roles) {
        this.dag = dag;
        this.topology = dag.topologicalOrder();
        this.roles = roles;
    }

    /** Highlights the treatments, outcomes and adjustment set of one query. */
    public static GraphExplain forQuery(CausalDag dag, Set<String> treatments, Set<String> outcomes,
            Set<String> adjustment) {
        Map<String, Role> roles = new LinkedHashMap<>();
        treatments.forEach(t -> roles.put(t, Role.TREATMENT));
        outcomes.forEach(o -> roles.put(o, Role.OUTCOME));
        adjustment.forEach(z -> roles.put(z, Role.ADJUSTMENT));
        return new GraphExplain(dag, roles);
    }

    /**
     * Dumps the parents, children and ancestry of a single variable.
     */
    public String explainNode(String nodeName) {
        int idx = topology.topoIndex(nodeName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Exogenous: ").append(topology.isRoot(idx)).append('\n');
        Role role = roles.get(nodeName);
        if (role != null)
            sb.append("  Role: ").append(role).append('\n');
        sb.append("  Parents: ").append(String.join(", ", dag.parents(nodeName))).append('\n')
                .append("  Children: ").append(String.join(", ", dag.children(nodeName))).append('\n')
                .append("  Ancestors: ").append(dag.ancestors(nodeName).size())
                .append(", Descendants: ").append(dag.descendants(nodeName).size());
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire topology in dot-like text format, causes before effects.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Causal DAG (").append(topology.nodeCount()).append(" nodes):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            String node = topology.node(i);
            sb.append("  [").append(i).append("] ").append(node);
            Role role = roles.get(node);
            if (role != null)
                sb.append(" (").append(role).append(')');
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Renders variables and causal edges in a format suitable for embedding in
     * Markdown; query roles become CSS classes. Node ids are {@code n<topo
     * index>}, the variable name is the label.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");

        // 1. Declare nodes in topological order
        for (int i = 0; i < topology.nodeCount(); i++)
            sb.append("  ").append(mermaidId(i)).append("[\"").append(topology.node(i).replace("\"", "#quot;"))
                    .append("\"];\n");

        // 2. Declare all edges afterwards
        for (int i = 0; i < topology.nodeCount(); i++)
            for (int j = 0; j < topology.childCount(i); j++)
                sb.append("  ").append(mermaidId(i)).append(" --> ")
                        .append(mermaidId(topology.child(i, j))).append(";\n");

        // 3. Role styling
        if (!roles.isEmpty()) {
            sb.append("  classDef treatment fill:#cfe8ff;\n")
                    .append("  classDef outcome fill:#ffe0c2;\n")
                    .append("  classDef adjustment fill:#d9f2d0;\n");
            for (var e : roles.entrySet())
                sb.append("  class ").append(mermaidId(topology.topoIndex(e.getKey()))).append(' ')
                        .append(e.getValue().name().toLowerCase(Locale.ROOT)).append(";\n");
        }
        return sb.toString();
    }

    private static String mermaidId(int topoIndex) {
        return "n" + topoIndex;
    }
}
