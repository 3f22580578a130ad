package com.causaltest.dag;

import com.causaltest.dag.api.CycleException;
import com.causaltest.dag.api.NoAdjustmentSetException;
import com.causaltest.dag.api.UnknownNodeException;
import com.causaltest.dag.engine.Edge;
import com.causaltest.dag.io.GraphDefinition;
import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class CausalDagTest {

    private static final String INFECTIONS = "Cumulative Infections";

    private static CausalDag dag(String... edges) {
        CausalDag dag = new CausalDag();
        for (String e : edges) {
            String[] parts = e.split("->");
            dag.addEdge(parts[0].trim(), parts[1].trim());
        }
        return dag;
    }

    private Path resource(String name) throws Exception {
        return Paths.get(getClass().getResource("/dags/" + name).toURI());
    }

    private static void assertMinimal(CausalDag dag, Set<String> xs, Set<String> ys, Set<String> zs) {
        assertTrue(dag.isValidAdjustmentSet(xs, ys, zs));
        for (String z : zs) {
            Set<String> smaller = new HashSet<>(zs);
            smaller.remove(z);
            assertFalse("still valid without " + z, dag.isValidAdjustmentSet(xs, ys, smaller));
        }
    }

    @Test
    public void testVaccineScenario() throws Exception {
        CausalDag dag = CausalDag.fromDotFile(resource("vaccine.dot"));
        assertEquals("vaccine", dag.name());
        assertEquals(3, dag.nodes().size());
        assertEquals(3, dag.edges().size());

        Set<String> t = Set.of("Vaccine");
        Set<String> o = Set.of(INFECTIONS);
        assertEquals(Set.of(), dag.properCausalPathway(t, o));

        CausalDag proper = dag.properBackdoorGraph(t, o);
        assertFalse(proper.containsEdge("Vaccine", INFECTIONS));
        assertTrue(proper.containsEdge("Age", INFECTIONS));
        assertTrue(proper.containsEdge("Age", "Vaccine"));
        assertTrue(dag.containsEdge("Vaccine", INFECTIONS));

        assertEquals(Set.of("Age"), dag.minimalAdjustmentSet(t, o));
    }

    @Test(expected = CycleException.class)
    public void testCyclicFileRejected() throws Exception {
        CausalDag.fromDotFile(resource("cyclic.dot"));
    }

    @Test
    public void testSmokingFromJson() throws Exception {
        CausalDag dag = CausalDag.fromJsonFile(resource("smoking.json"));
        Set<String> t = Set.of("Smoking");
        Set<String> o = Set.of("Cancer");
        assertEquals(Set.of("Tar"), dag.properCausalPathway(t, o));
        assertEquals(Set.of("Genotype"), dag.minimalAdjustmentSet(t, o));
        assertFalse(dag.isValidAdjustmentSet(t, o, Set.of("Genotype", "Tar")));
        assertFalse(dag.isValidAdjustmentSet(t, o, Set.of()));
    }

    @Test
    public void testConfounderWithMediator() {
        CausalDag dag = dag("Z -> X", "Z -> Y", "X -> M", "M -> Y");
        assertEquals(Set.of("M"), dag.properCausalPathway(Set.of("X"), Set.of("Y")));
        assertEquals(Set.of("Z"), dag.minimalAdjustmentSet(Set.of("X"), Set.of("Y")));
    }

    @Test
    public void testMBiasNeedsNoAdjustment() {
        CausalDag dag = dag("A -> X", "A -> M", "B -> M", "B -> Y", "X -> Y");
        Set<String> t = Set.of("X");
        Set<String> o = Set.of("Y");
        assertEquals(Set.of(), dag.minimalAdjustmentSet(t, o));
        assertTrue(dag.isValidAdjustmentSet(t, o, Set.of()));
        assertFalse(dag.isValidAdjustmentSet(t, o, Set.of("M")));
        assertTrue(dag.isValidAdjustmentSet(t, o, Set.of("M", "A")));
    }

    @Test
    public void testTwoConfounders() {
        CausalDag dag = dag("C1 -> X", "C1 -> Y", "C2 -> X", "C2 -> Y", "X -> Y");
        assertEquals(Set.of("C1", "C2"), dag.minimalAdjustmentSet(Set.of("X"), Set.of("Y")));
    }

    @Test
    public void testLongBackdoorPathBlockedOnce() {
        CausalDag dag = dag("B -> A", "A -> X", "B -> C", "C -> Y", "X -> Y");
        Set<String> z = dag.minimalAdjustmentSet(Set.of("X"), Set.of("Y"));
        assertEquals(1, z.size());
        assertMinimal(dag, Set.of("X"), Set.of("Y"), z);
    }

    @Test
    public void testMultipleTreatments() {
        CausalDag dag = dag("C -> X1", "C -> Y", "X1 -> X2", "X2 -> Y");
        assertEquals(Set.of("C"), dag.minimalAdjustmentSet(Set.of("X1", "X2"), Set.of("Y")));
    }

    @Test
    public void testDisconnectedVariablesNeedNoAdjustment() {
        CausalDag dag = new CausalDag();
        dag.addNode("X");
        dag.addNode("Y");
        assertEquals(Set.of(), dag.minimalAdjustmentSet(Set.of("X"), Set.of("Y")));
    }

    @Test
    public void testDirectEffectOnlyNeedsNoAdjustment() {
        CausalDag dag = dag("X -> Y");
        assertEquals(Set.of(), dag.minimalAdjustmentSet(Set.of("X"), Set.of("Y")));
    }

    @Test(expected = NoAdjustmentSetException.class)
    public void testReverseEdgeHasNoAdjustmentSet() {
        dag("Y -> X").minimalAdjustmentSet(Set.of("X"), Set.of("Y"));
    }

    @Test(expected = NoAdjustmentSetException.class)
    public void testEmptyTreatments() {
        dag("X -> Y").minimalAdjustmentSet(Set.of(), Set.of("Y"));
    }

    @Test(expected = NoAdjustmentSetException.class)
    public void testOverlappingTreatmentsAndOutcomes() {
        dag("X -> Y").minimalAdjustmentSet(Set.of("X"), Set.of("X", "Y"));
    }

    @Test
    public void testUnknownTreatment() {
        try {
            dag("X -> Y").minimalAdjustmentSet(Set.of("Dose"), Set.of("Y"));
            fail("Expected UnknownNodeException");
        } catch (UnknownNodeException e) {
            assertEquals("Dose", e.nodeName());
        }
    }

    @Test(expected = UnknownNodeException.class)
    public void testUnknownCovariate() {
        dag("X -> Y").isValidAdjustmentSet(Set.of("X"), Set.of("Y"), Set.of("Z"));
    }

    @Test
    public void testMinimalityOnLargerGraph() {
        CausalDag dag = dag(
                "U1 -> X", "U1 -> W", "W -> Y",
                "U2 -> X", "U2 -> V", "V -> Y",
                "U3 -> U1", "U3 -> U2",
                "X -> M", "M -> Y", "M -> S", "Y -> S");
        Set<String> t = Set.of("X");
        Set<String> o = Set.of("Y");
        Set<String> z = dag.minimalAdjustmentSet(t, o);
        assertFalse(z.contains("M"));
        assertFalse(z.contains("S"));
        assertMinimal(dag, t, o, z);
    }

    @Test
    public void testIncompleteDefinitionRejected() {
        GraphDefinition def = new GraphDefinition();
        def.getEdges().add(new GraphDefinition.EdgeDef("A", null));
        try {
            CausalDag.fromDefinition(def);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Malformed graph definition: edge 0 has no target", e.getMessage());
        }
    }

    @Test
    public void testCycleRejectedAndDagUnchanged() {
        CausalDag dag = dag("A -> B", "B -> C");
        CausalDag before = dag.copy();
        try {
            dag.addEdge("C", "A");
            fail("Expected CycleException");
        } catch (CycleException e) {
            assertTrue(e.getMessage().startsWith("Invalid causal DAG"));
        }
        assertEquals(before, dag);
        assertTrue(dag.isAcyclic());
    }

    @Test
    public void testBackdoorGraphDropsTreatmentEdges() {
        CausalDag dag = dag("Z -> X", "X -> M", "X -> Y", "M -> Y", "Z -> Y");
        CausalDag backdoor = dag.backdoorGraph(Set.of("X"));
        assertEquals(Set.of(), backdoor.children("X"));
        assertEquals(Set.of("Z"), backdoor.parents("X"));
        assertEquals(dag.nodes(), backdoor.nodes());
        assertEquals(Set.of("M", "Y"), dag.children("X"));
    }

    @Test
    public void testCopyIsIndependent() {
        CausalDag dag = dag("A -> B");
        CausalDag copy = dag.copy();
        copy.addEdge("B", "C");
        assertFalse(dag.containsNode("C"));
        assertTrue(copy.removeEdge("A", "B"));
        assertTrue(dag.containsEdge("A", "B"));
    }

    @Test
    public void testDotRoundTrip() {
        CausalDag dag = CausalDag.fromDot("digraph g { Age -> Vaccine; Age -> \"Cumulative Infections\"; Lonely }");
        String dot = dag.toDot();
        assertTrue(dot.startsWith("digraph g {\n"));
        CausalDag again = CausalDag.fromDot(dot);
        assertEquals(dag, again);
        assertEquals(List.of("Age", "Vaccine", INFECTIONS, "Lonely"), List.copyOf(again.nodes()));
        assertEquals(new Edge("Age", "Vaccine"), again.edges().get(0));
    }

    @Test
    public void testDSeparationQuery() {
        CausalDag dag = dag("A -> B", "B -> C");
        assertFalse(dag.isDSeparated(Set.of("A"), Set.of("C"), Set.of()));
        assertTrue(dag.isDSeparated(Set.of("A"), Set.of("C"), Set.of("B")));
    }

    @Test
    public void testTopologicalOrder() {
        CausalDag dag = dag("Vaccine -> Infections", "Age -> Vaccine", "Age -> Infections");
        assertEquals(List.of("Age", "Vaccine", "Infections"), dag.topologicalOrder().nodes());
        assertEquals(Set.of("Vaccine", "Infections"), dag.descendants("Age"));
        assertEquals(Set.of("Age", "Vaccine"), dag.ancestors("Infections"));
    }
}
