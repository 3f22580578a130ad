package com.causaltest.dag.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a causal DAG, independent of its textual format.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class GraphDefinition {
    private String name;
    private boolean strict;
    private List<NodeDef> nodes = new ArrayList<>();
    private List<EdgeDef> edges = new ArrayList<>();

    /** A variable, with any attributes carried by the source file. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name;
        private Map<String, String> attributes = new LinkedHashMap<>();

        public NodeDef(String name) {
            this.name = name;
        }
    }

    /** A causal edge {@code source -> target}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EdgeDef {
        private String source, target;
        private Map<String, String> attributes = new LinkedHashMap<>();

        public EdgeDef(String source, String target) {
            this.source = source;
            this.target = target;
        }
    }

    /**
     * Checks that every node has a name and every edge both endpoints.
     *
     * @return this definition
     * @throws IllegalArgumentException naming the first incomplete entry.
     */
    public GraphDefinition validate() {
        if (nodes != null)
            for (int i = 0; i < nodes.size(); i++)
                if (nodes.get(i) == null || nodes.get(i).getName() == null)
                    throw new IllegalArgumentException("Malformed graph definition: node " + i + " has no name");
        if (edges != null) {
            for (int i = 0; i < edges.size(); i++) {
                EdgeDef ed = edges.get(i);
                if (ed == null || ed.getSource() == null)
                    throw new IllegalArgumentException("Malformed graph definition: edge " + i + " has no source");
                if (ed.getTarget() == null)
                    throw new IllegalArgumentException("Malformed graph definition: edge " + i + " has no target");
            }
        }
        return this;
    }

    /** Returns the node definition with this name, adding it if absent. */
    public NodeDef node(String nodeName) {
        for (NodeDef nd : nodes)
            if (nd.getName().equals(nodeName))
                return nd;
        NodeDef nd = new NodeDef(nodeName);
        nodes.add(nd);
        return nd;
    }
}
