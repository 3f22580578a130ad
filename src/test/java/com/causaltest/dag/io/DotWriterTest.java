package com.causaltest.dag.io;

import org.junit.Test;

import java.util.Locale;

import static org.junit.Assert.*;

public class DotWriterTest {

    @Test
    public void testWrite() {
        GraphDefinition def = new GraphDefinition();
        def.setName("vaccine");
        def.node("Age");
        def.node("Cumulative Infections");
        GraphDefinition.EdgeDef e = new GraphDefinition.EdgeDef("Age", "Cumulative Infections");
        e.getAttributes().put("label", "effect");
        def.getEdges().add(e);

        assertEquals("digraph vaccine {\n"
                + "  Age;\n"
                + "  \"Cumulative Infections\";\n"
                + "  Age -> \"Cumulative Infections\" [label=effect];\n"
                + "}\n", DotWriter.write(def));
    }

    @Test
    public void testIdQuoting() {
        assertEquals("Age", DotWriter.id("Age"));
        assertEquals("-2.5", DotWriter.id("-2.5"));
        assertEquals("\"node\"", DotWriter.id("node"));
        assertEquals("\"2x\"", DotWriter.id("2x"));
        assertEquals("\"say \\\"hi\\\"\"", DotWriter.id("say \"hi\""));
    }

    @Test
    public void testKeywordsQuotedUnderTurkishLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("\"DIGRAPH\"", DotWriter.id("DIGRAPH"));
            assertEquals("\"SUBGRAPH\"", DotWriter.id("SUBGRAPH"));

            GraphDefinition def = new GraphDefinition();
            def.getEdges().add(new GraphDefinition.EdgeDef("DIGRAPH", "Y"));
            def.node("DIGRAPH");
            def.node("Y");
            assertEquals(def, DotParser.parse(DotWriter.write(def)));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void testParserReadsWriterOutput() {
        GraphDefinition def = DotParser.parse("strict digraph \"my graph\" {\n"
                + "  \"Edge\" [label=\"a \\\"b\\\" c\", pos=\"1,2\"];\n"
                + "  \"Edge\" -> \"C:\\\\tmp\" -> z [w=0.5];\n"
                + "}");
        assertEquals(def, DotParser.parse(DotWriter.write(def)));
    }
}
