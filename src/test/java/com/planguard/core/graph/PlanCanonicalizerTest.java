package com.planguard.core.graph;

import com.planguard.core.plan.ActionNode;
import com.planguard.core.plan.Anchors;
import com.planguard.core.plan.DependencyEdge;
import com.planguard.core.plan.Plan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PlanCanonicalizerTest {

    private final PlanCanonicalizer canonicalizer = new PlanCanonicalizer();

    private static List<String> ids(Plan plan) {
        return plan.getNodes().stream().map(ActionNode::getId).collect(Collectors.toList());
    }

    private static List<String> edges(Plan plan) {
        return plan.getEdges().stream().map(DependencyEdge::toString).collect(Collectors.toList());
    }

    @Test
    void testRenamesToOrdinalsInTopologicalOrderAndCleansEdges() {
        Plan plan = new Plan("g",
                List.of(new ActionNode("x", "stack", Map.of(), "last"),
                        new ActionNode("y", "pick-up", Map.of(), "middle"),
                        new ActionNode("z", "unstack", Map.of(), "first")),
                List.of(DependencyEdge.of("y", "x"),
                        DependencyEdge.of("z", "y"),
                        new DependencyEdge("z", "y", "duplicate"),
                        DependencyEdge.of("x", "x")));

        Plan canonical = canonicalizer.canonicalize(plan);

        assertEquals(List.of("1", "2", "3"), ids(canonical));
        assertEquals("first", canonical.findNode("1").get().getDescription());
        assertEquals("last", canonical.findNode("3").get().getDescription());
        assertEquals(List.of("2 -> 3", "1 -> 2"), edges(canonical));
        assertEquals("depends_on", canonical.getEdges().get(1).getRelationship());
    }

    @Test
    void testIsIdempotent() {
        Plan plan = new Plan("g",
                List.of(ActionNode.of("b", "stack"), ActionNode.of("a", "pick-up"), ActionNode.of("c", "put-down")),
                List.of(DependencyEdge.of("a", "b"), DependencyEdge.of("b", "c"), DependencyEdge.of("a", "b")));

        Plan once  = canonicalizer.canonicalize(plan);
        Plan twice = canonicalizer.canonicalize(once);

        assertEquals(once, twice);
    }

    @Test
    void testCyclicInputKeepsIdsAndDoesNotThrow() {
        Plan plan = new Plan("g",
                List.of(ActionNode.of("a", "task"), ActionNode.of("b", "task")),
                List.of(DependencyEdge.of("a", "b"), DependencyEdge.of("b", "a"),
                        DependencyEdge.of("a", "b"), DependencyEdge.of("b", "b")));

        Plan canonical = assertDoesNotThrow(() -> canonicalizer.canonicalize(plan));

        assertEquals(List.of("a", "b"), ids(canonical));
        assertEquals(List.of("a -> b", "b -> a"), edges(canonical));
        assertEquals(canonical, canonicalizer.canonicalize(canonical));
    }

    @Test
    void testEdgeOnlyAnchorsBecomeNodes() {
        Plan plan = new Plan("g",
                List.of(ActionNode.of("a", "task")),
                List.of(DependencyEdge.of(Anchors.START_ID, "a"), DependencyEdge.of("a", Anchors.END_ID)));

        Plan canonical = canonicalizer.canonicalize(plan);

        assertEquals(3, canonical.size());
        assertTrue(canonical.findNode("1").get().isAnchor());
        assertFalse(canonical.findNode("2").get().isAnchor());
        assertTrue(canonical.findNode("3").get().isAnchor());
        assertEquals(List.of("1 -> 2", "2 -> 3"), edges(canonical));
    }

    @Test
    void testEmptyPlanStaysEmpty() {
        assertTrue(canonicalizer.canonicalize(Plan.empty("g")).isEmpty());
    }
}
