package com.planguard.core.plan;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanJsonParserTest {

    private final PlanJsonParser parser = new PlanJsonParser();

    @Test
    void testParsesCanonicalSchema() {
        String json = """
            {
              "goal_description": "Stack a on b",
              "nodes": [
                {"id": "s1", "action_type": "pick-up", "params": {"block": "a"}, "description": "Pick up a"},
                {"id": "s2", "action_type": "stack", "params": {"block": "a", "target": "b"}}
              ],
              "edges": [{"source": "s1", "target": "s2", "relationship": "depends_on"}]
            }
            """;

        Plan plan = parser.parse("fallback", json);

        assertEquals("Stack a on b", plan.getGoalDescription());
        assertEquals(2, plan.size());
        assertEquals(Map.of("block", "a", "target", "b"), plan.findNode("s2").get().getParams());
        assertEquals("s1 -> s2", plan.getEdges().get(0).toString());
    }

    @Test
    void testStripsMarkdownFencesAndLeadingProse() {
        String raw = """
            ```json
            Here is the plan:
            {"nodes": [{"id": "1", "actionType": "PickUp", "parameters": {"x": "a"}}], "edges": []}
            ```
            """;

        Plan plan = parser.parse("fallback goal", raw);

        assertEquals("fallback goal", plan.getGoalDescription());
        assertEquals("PickUp", plan.findNode("1").get().getActionType());
        assertEquals("a", plan.findNode("1").get().getParams().get("x"));
    }

    @Test
    void testUnwrapsPlanEnvelopeAndEdgeAliases() {
        String json = """
            {"plan": {"nodes": [{"id": "a", "type": "pick-up"}, {"id": "b", "type": "stack"}],
                      "edges": [{"from": "a", "to": "b"}]}}
            """;

        Plan plan = parser.parse("g", json);

        assertEquals(2, plan.size());
        assertEquals("depends_on", plan.getEdges().get(0).getRelationship());
    }

    @Test
    void testEmptyResponseIsAParseError() {
        assertThrows(PlanParseException.class, () -> parser.parse("g", "   "));
    }

    @Test
    void testMalformedJsonIsAParseError() {
        PlanParseException e = assertThrows(PlanParseException.class,
                () -> parser.parse("g", "{\"nodes\": [ {\"id\": \"a\" "));
        assertTrue(e.getMessage().startsWith("Malformed plan JSON"));
    }

    @Test
    void testDuplicateIdsSurfaceAsParseError() {
        String json = """
            {"nodes": [{"id": "a", "action_type": "pick-up"}, {"id": "a", "action_type": "stack"}]}
            """;

        PlanParseException e = assertThrows(PlanParseException.class, () -> parser.parse("g", json));
        assertTrue(e.getMessage().contains("Duplicate node id"));
    }

    @Test
    void testMissingNodesArray() {
        assertThrows(PlanParseException.class, () -> parser.parse("g", "{\"edges\": []}"));
    }
}
