package com.causaltest.dag.io;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders a {@link GraphDefinition} as dot text that {@link DotParser} reads
 * back to an equal definition.
 */
public final class DotWriter {
    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*|-?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)");

    private DotWriter() {
        // Utility class
    }

    public static String write(GraphDefinition def) {
        StringBuilder sb = new StringBuilder(256);
        if (def.isStrict())
            sb.append("strict ");
        sb.append("digraph");
        if (def.getName() != null)
            sb.append(' ').append(id(def.getName()));
        sb.append(" {\n");
        for (GraphDefinition.NodeDef nd : def.getNodes()) {
            sb.append("  ").append(id(nd.getName()));
            attributes(sb, nd.getAttributes());
            sb.append(";\n");
        }
        for (GraphDefinition.EdgeDef ed : def.getEdges()) {
            sb.append("  ").append(id(ed.getSource())).append(" -> ").append(id(ed.getTarget()));
            attributes(sb, ed.getAttributes());
            sb.append(";\n");
        }
        return sb.append("}\n").toString();
    }

    private static void attributes(StringBuilder sb, Map<String, String> attrs) {
        if (attrs == null || attrs.isEmpty())
            return;
        sb.append(" [");
        boolean first = true;
        for (var e : attrs.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(id(e.getKey())).append('=').append(id(e.getValue()));
            first = false;
        }
        sb.append(']');
    }

    static String id(String raw) {
        if (PLAIN_ID.matcher(raw).matches() && !isKeyword(raw))
            return raw;
        // the parser keeps every backslash except the one before a quote
        return '"' + raw.replace("\"", "\\\"") + '"';
    }

    private static boolean isKeyword(String s) {
        return switch (s.toLowerCase(Locale.ROOT)) {
            case "strict", "graph", "digraph", "node", "edge", "subgraph" -> true;
            default -> false;
        };
    }
}
