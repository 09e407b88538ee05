package com.planguard.core.domain;

import com.planguard.core.plan.ActionNode;
import com.planguard.core.plan.Anchors;
import com.planguard.core.plan.DependencyEdge;
import com.planguard.core.plan.Plan;
import com.planguard.core.verification.Layer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionSequenceBuilderTest {

    private final ActionSequenceBuilder builder = new ActionSequenceBuilder();

    @Test
    void testFollowsDependencyOrderAndSkipsAnchors() {
        Plan plan = new Plan("g",
                List.of(new ActionNode("s2", "stack", Map.of("block", "a", "target", "b"), ""),
                        new ActionNode("s1", "pick-up", Map.of("block", "a"), ""),
                        Anchors.start()),
                List.of(DependencyEdge.of(Anchors.START_ID, "s1"), DependencyEdge.of("s1", "s2")));

        ActionSequence sequence = builder.build(plan, PlanningDomain.BLOCKSWORLD);

        assertTrue(sequence.isComplete());
        assertEquals(List.of("(pick-up a)", "(stack a b)"), sequence.toLines());
    }

    @Test
    void testUnconvertibleNodeYieldsParseDiagnostic() {
        Plan plan = new Plan("g",
                List.of(new ActionNode("s1", "pick-up", Map.of("block", "a"), ""),
                        new ActionNode("s2", "juggle", Map.of("block", "a"), "")),
                List.of(DependencyEdge.of("s1", "s2")));

        ActionSequence sequence = builder.build(plan, PlanningDomain.BLOCKSWORLD);

        assertFalse(sequence.isComplete());
        assertEquals(List.of("(pick-up a)"), sequence.toLines());
        assertEquals(1, sequence.getDiagnostics().size());
        assertEquals(Layer.PARSE, sequence.getDiagnostics().get(0).getLayer());
        assertTrue(sequence.getDiagnostics().get(0).getMessage().contains("'s2'"));
    }

    @Test
    void testGeneratedVirtualNodeIsReportedNotDropped() {
        Plan plan = new Plan("g",
                List.of(new ActionNode("s1", "pick-up", Map.of("block", "a"), ""),
                        new ActionNode("s2", Anchors.ACTION_TYPE, Map.of("block", "a"), "wait")),
                List.of(DependencyEdge.of("s1", "s2")));

        ActionSequence sequence = builder.build(plan, PlanningDomain.BLOCKSWORLD);

        assertFalse(sequence.isComplete());
        assertEquals(List.of("(pick-up a)"), sequence.toLines());
        assertEquals(Layer.PARSE, sequence.getDiagnostics().get(0).getLayer());
        assertTrue(sequence.getDiagnostics().get(0).getMessage().contains("'s2'"));
    }

    @Test
    void testRenamedEngineAnchorsAreStillSkipped() {
        Plan plan = new Plan("g",
                List.of(Anchors.start().withId("1"),
                        new ActionNode("2", "pick-up", Map.of("block", "a"), ""),
                        Anchors.end().withId("3")),
                List.of(DependencyEdge.of("1", "2"), DependencyEdge.of("2", "3")));

        ActionSequence sequence = builder.build(plan, PlanningDomain.BLOCKSWORLD);

        assertTrue(sequence.isComplete());
        assertEquals(List.of("(pick-up a)"), sequence.toLines());
    }

    @Test
    void testCyclicPlanFallsBackToNodeOrder() {
        Plan plan = new Plan("g",
                List.of(new ActionNode("a", "pick-up", Map.of("block", "x"), ""),
                        new ActionNode("b", "put-down", Map.of("block", "x"), "")),
                List.of(DependencyEdge.of("a", "b"), DependencyEdge.of("b", "a")));

        assertEquals(List.of("(pick-up x)", "(put-down x)"),
                builder.build(plan, PlanningDomain.BLOCKSWORLD).toLines());
    }
}
