package com.planguard.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PlanJsonParser — ingestion boundary from raw generator text to {@link Plan}.
 *
 * CANONICAL JSON SCHEMA:
 * {
 *   "goal_description": "...",
 *   "nodes": [ {"id": "...", "action_type": "...", "params": {...}, "description": "..."} ],
 *   "edges": [ {"source": "...", "target": "...", "relationship": "depends_on"} ]
 * }
 *
 * Accepts camelCase keys (goalDescription, actionType) and "parameters" as
 * aliases. Strips markdown fences and leading prose before parsing.
 * Parameter values are flattened to text; nested values keep their JSON form.
 */
public class PlanJsonParser {

    private static final Logger log = LoggerFactory.getLogger(PlanJsonParser.class);

    private final ObjectMapper mapper;

    public PlanJsonParser() {
        this(new ObjectMapper());
    }

    public PlanJsonParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param fallbackGoal goal used when the document carries none
     * @throws PlanParseException on blank input, malformed JSON, or a document
     *                            that violates the plan invariants
     */
    public Plan parse(String fallbackGoal, String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new PlanParseException("Generator returned an empty response");
        }

        String cleaned = stripWrapping(rawText);

        JsonNode root;
        try {
            root = mapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Malformed plan JSON: " + e.getOriginalMessage(), e);
        }

        // Some models wrap the plan as {"plan": {...}}
        if (root.has("plan") && root.get("plan").isObject()) {
            root = root.get("plan");
        }

        String goal = text(root, "goal_description", "goalDescription");
        if (goal == null || goal.isBlank()) goal = fallbackGoal;

        List<ActionNode> nodes = new ArrayList<>();
        JsonNode nodesNode = root.get("nodes");
        if (nodesNode == null || !nodesNode.isArray()) {
            throw new PlanParseException("Plan JSON has no 'nodes' array");
        }
        for (JsonNode n : nodesNode) {
            String id = text(n, "id");
            if (id == null || id.isBlank()) {
                throw new PlanParseException("Node without id: " + n);
            }
            nodes.add(new ActionNode(
                    id.trim(),
                    text(n, "action_type", "actionType", "type"),
                    params(n),
                    text(n, "description")));
        }

        List<DependencyEdge> edges = new ArrayList<>();
        JsonNode edgesNode = root.get("edges");
        if (edgesNode != null && edgesNode.isArray()) {
            for (JsonNode e : edgesNode) {
                String source = text(e, "source", "from");
                String target = text(e, "target", "to");
                if (source == null || target == null) {
                    throw new PlanParseException("Edge without source/target: " + e);
                }
                edges.add(new DependencyEdge(source.trim(), target.trim(), text(e, "relationship")));
            }
        }

        try {
            Plan plan = new Plan(goal, nodes, edges);
            log.debug("[PlanParser] Parsed {}", plan);
            return plan;
        } catch (IllegalArgumentException e) {
            throw new PlanParseException("Plan violates graph invariants: " + e.getMessage(), e);
        }
    }

    private String stripWrapping(String rawText) {
        String cleaned = rawText.trim();

        if (cleaned.startsWith("```")) {
            int start = cleaned.indexOf('\n') + 1;
            int end   = cleaned.lastIndexOf("```");
            if (end > start) cleaned = cleaned.substring(start, end).trim();
        }

        int jsonStart = cleaned.indexOf('{');
        if (jsonStart > 0) cleaned = cleaned.substring(jsonStart);
        return cleaned;
    }

    private Map<String, String> params(JsonNode node) {
        JsonNode p = node.has("params") ? node.get("params") : node.get("parameters");
        Map<String, String> out = new LinkedHashMap<>();
        if (p == null || !p.isObject()) return out;

        Iterator<Map.Entry<String, JsonNode>> fields = p.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            JsonNode v = f.getValue();
            if (v == null || v.isNull()) continue;
            out.put(f.getKey(), v.isValueNode() ? v.asText() : v.toString());
        }
        return out;
    }

    private static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode v = node.get(key);
            if (v != null && !v.isNull()) return v.asText();
        }
        return null;
    }
}
