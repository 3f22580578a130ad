package com.causaltest.dag.io;

import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class DotParserTest {

    private static List<String> nodeNames(GraphDefinition def) {
        List<String> names = new ArrayList<>();
        def.getNodes().forEach(n -> names.add(n.getName()));
        return names;
    }

    private static List<String> edgeList(GraphDefinition def) {
        List<String> edges = new ArrayList<>();
        def.getEdges().forEach(e -> edges.add(e.getSource() + "->" + e.getTarget()));
        return edges;
    }

    @Test
    public void testVaccineFile() throws Exception {
        Path path = Paths.get(getClass().getResource("/dags/vaccine.dot").toURI());
        GraphDefinition def = DotParser.parseFile(path);

        assertEquals("vaccine", def.getName());
        assertFalse(def.isStrict());
        assertEquals(List.of("Age", "Vaccine", "Cumulative Infections"), nodeNames(def));
        assertEquals(List.of("Age->Vaccine", "Age->Cumulative Infections", "Vaccine->Cumulative Infections"),
                edgeList(def));
        assertEquals(Map.of("label", "Age (years)"), def.node("Age").getAttributes());
        assertEquals("effect", def.getEdges().get(2).getAttributes().get("label"));
    }

    @Test
    public void testEdgeChainSharesAttributes() {
        GraphDefinition def = DotParser.parse("digraph { A -> B -> C [weight=2] }");
        assertEquals(List.of("A->B", "B->C"), edgeList(def));
        for (GraphDefinition.EdgeDef e : def.getEdges())
            assertEquals("2", e.getAttributes().get("weight"));
    }

    @Test
    public void testSubgraphEndpoints() {
        GraphDefinition def = DotParser.parse("digraph { {A B} -> C; D -> subgraph s { E; F } }");
        assertEquals(List.of("A->C", "B->C", "D->E", "D->F"), edgeList(def));
        assertEquals(List.of("A", "B", "C", "D", "E", "F"), nodeNames(def));
    }

    @Test
    public void testDuplicateEdgeMergesAttributes() {
        GraphDefinition def = DotParser.parse("digraph { A -> B; A -> B [color=red] }");
        assertEquals(1, def.getEdges().size());
        assertEquals("red", def.getEdges().get(0).getAttributes().get("color"));
    }

    @Test
    public void testStrictHeaderAndKeywordCase() {
        GraphDefinition def = DotParser.parse("STRICT DiGraph g { x }");
        assertTrue(def.isStrict());
        assertEquals("g", def.getName());
        assertEquals(List.of("x"), nodeNames(def));
    }

    @Test
    public void testQuotedConcatenation() {
        GraphDefinition def = DotParser.parse("digraph { \"Cumulative \" + \"Infections\" -> \"say \\\"hi\\\"\" }");
        assertEquals(List.of("Cumulative Infections", "say \"hi\""), nodeNames(def));
    }

    @Test
    public void testHtmlLabel() {
        GraphDefinition def = DotParser.parse("digraph { Age [label=<<b>Age</b>>] }");
        assertEquals("<b>Age</b>", def.node("Age").getAttributes().get("label"));
    }

    @Test
    public void testPortsAndNumeralsAreIds() {
        GraphDefinition def = DotParser.parse("digraph { A:n -> B:s:e; 1 -> -2.5 }");
        assertEquals(List.of("A->B", "1->-2.5"), edgeList(def));
    }

    @Test
    public void testCommentsAndDefaultsIgnored() {
        String dot = "#line 1 \"gen.dot\"\n"
                + "/* header */ digraph {\n"
                + "  graph [rankdir=LR]; node [shape=box] edge [style=dashed]\n"
                + "  size = \"4,4\" // trailing\n"
                + "  A -> B\n"
                + "}\n";
        GraphDefinition def = DotParser.parse(dot);
        assertEquals(List.of("A", "B"), nodeNames(def));
        assertTrue(def.node("A").getAttributes().isEmpty());
        assertTrue(def.getEdges().get(0).getAttributes().isEmpty());
    }

    @Test
    public void testBareAttributeDefaultsToTrue() {
        GraphDefinition def = DotParser.parse("digraph { A [latent] }");
        assertEquals("true", def.node("A").getAttributes().get("latent"));
    }

    @Test
    public void testUndirectedGraphRejected() {
        try {
            DotParser.parse("graph { A -- B }");
            fail("Expected DotParseException");
        } catch (DotParseException e) {
            assertTrue(e.getMessage().contains("Undirected graphs are not supported"));
            assertEquals(1, e.line());
            assertEquals(1, e.column());
        }
    }

    @Test(expected = DotParseException.class)
    public void testUndirectedEdgeRejected() {
        DotParser.parse("digraph { A -- B }");
    }

    @Test
    public void testErrorPosition() {
        try {
            DotParser.parse("digraph {\n  A -> ;\n}");
            fail("Expected DotParseException");
        } catch (DotParseException e) {
            assertEquals(2, e.line());
            assertEquals(8, e.column());
            assertTrue(e.getMessage().endsWith("at line 2, column 8"));
        }
    }

    @Test(expected = DotParseException.class)
    public void testUnterminatedString() {
        DotParser.parse("digraph { \"Age -> B }");
    }

    @Test(expected = DotParseException.class)
    public void testUnterminatedComment() {
        DotParser.parse("digraph { A /* B }");
    }

    @Test(expected = DotParseException.class)
    public void testTrailingContentRejected() {
        DotParser.parse("digraph { A } digraph { B }");
    }

    @Test(expected = DotParseException.class)
    public void testMissingHeader() {
        DotParser.parse("{ A -> B }");
    }

    @Test
    public void testParserErrorsAreIllegalArguments() {
        try {
            DotParser.parse("digraph { A -> }");
            fail("Expected DotParseException");
        } catch (IllegalArgumentException e) {
            assertTrue(e instanceof DotParseException);
        }
    }
}
