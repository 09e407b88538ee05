package com.planguard.core.graph;

import com.planguard.core.plan.ActionNode;
import com.planguard.core.plan.Anchors;
import com.planguard.core.plan.DependencyEdge;
import com.planguard.core.plan.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PlanCanonicalizer — stable form of a plan for signatures and comparison.
 *
 * Acyclic input: nodes renamed "1".."N" in topological order, self-loops
 * dropped, duplicate edges collapsed (first relationship wins).
 *
 * Cyclic input: ids and node order are kept; only self-loops and duplicate
 * edges are removed.
 *
 * Idempotent. Never throws on well-formed plans.
 */
public class PlanCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(PlanCanonicalizer.class);

    private final GraphVerifier verifier;

    public PlanCanonicalizer() {
        this(new GraphVerifier());
    }

    public PlanCanonicalizer(GraphVerifier verifier) {
        this.verifier = verifier;
    }

    public Plan canonicalize(Plan plan) {
        Plan materialized = materializeAnchors(plan);

        List<DependencyEdge> withoutSelfLoops = materialized.getEdges().stream()
                .filter(e -> !e.isSelfLoop())
                .collect(Collectors.toList());
        Plan loopFree = new Plan(materialized.getGoalDescription(), materialized.getNodes(), withoutSelfLoops);

        List<String> order = verifier.topologicalOrder(loopFree);

        Map<String, String> rename = new LinkedHashMap<>();
        List<ActionNode> nodes = new ArrayList<>();

        if (order.isEmpty() && !loopFree.isEmpty()) {
            log.debug("[Canonicalizer] Cyclic plan, keeping original ids");
            for (ActionNode node : loopFree.getNodes()) {
                rename.put(node.getId(), node.getId());
                nodes.add(node);
            }
        } else {
            int ordinal = 1;
            for (String id : order) {
                ActionNode node = loopFree.findNode(id).orElseThrow();
                String newId = String.valueOf(ordinal++);
                rename.put(id, newId);
                nodes.add(node.withId(newId));
            }
        }

        List<DependencyEdge> edges = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (DependencyEdge edge : loopFree.getEdges()) {
            String source = rename.get(edge.getSource());
            String target = rename.get(edge.getTarget());
            if (source == null || target == null || source.equals(target)) continue;
            if (seen.add(source + "\u0000" + target)) {
                edges.add(new DependencyEdge(source, target, edge.getRelationship()));
            }
        }

        return new Plan(plan.getGoalDescription(), nodes, edges);
    }

    /**
     * Adds a node for every anchor id referenced only by edges, so that every
     * edge endpoint takes part in the renaming.
     */
    private Plan materializeAnchors(Plan plan) {
        Map<String, ActionNode> missing = new HashMap<>();
        for (DependencyEdge edge : plan.getEdges()) {
            for (String id : List.of(edge.getSource(), edge.getTarget())) {
                if (!plan.containsNode(id) && !missing.containsKey(id)) {
                    missing.put(id, Anchors.START_ID.equals(id) ? Anchors.start() : Anchors.end());
                }
            }
        }
        if (missing.isEmpty()) return plan;

        List<ActionNode> extra = new ArrayList<>();
        if (missing.containsKey(Anchors.START_ID)) extra.add(missing.get(Anchors.START_ID));
        if (missing.containsKey(Anchors.END_ID))   extra.add(missing.get(Anchors.END_ID));
        return plan.withAdditions(extra, List.of());
    }
}
