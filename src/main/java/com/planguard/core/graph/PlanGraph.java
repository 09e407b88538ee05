package com.planguard.core.graph;

import com.planguard.core.plan.ActionNode;
import com.planguard.core.plan.DependencyEdge;
import com.planguard.core.plan.Plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PlanGraph — read-only directed-graph view of a {@link Plan}.
 *
 * Vertices are the plan's node ids in insertion order, followed by any anchor
 * id that an edge references without a matching node. Parallel edges collapse
 * into one adjacency entry; self-loops are kept.
 */
public final class PlanGraph {

    private final List<String>             vertices;
    private final Map<String, Integer>     order;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    private PlanGraph(List<String> vertices,
                      Map<String, Set<String>> successors,
                      Map<String, Set<String>> predecessors) {
        this.vertices     = List.copyOf(vertices);
        this.successors   = successors;
        this.predecessors = predecessors;
        this.order        = new HashMap<>();
        for (int i = 0; i < this.vertices.size(); i++) {
            order.put(this.vertices.get(i), i);
        }
    }

    public static PlanGraph of(Plan plan) {
        List<String> vertices = new ArrayList<>();
        Map<String, Set<String>> succ = new LinkedHashMap<>();
        Map<String, Set<String>> pred = new LinkedHashMap<>();

        for (ActionNode node : plan.getNodes()) {
            addVertex(node.getId(), vertices, succ, pred);
        }
        for (DependencyEdge edge : plan.getEdges()) {
            addVertex(edge.getSource(), vertices, succ, pred);
            addVertex(edge.getTarget(), vertices, succ, pred);
            succ.get(edge.getSource()).add(edge.getTarget());
            pred.get(edge.getTarget()).add(edge.getSource());
        }
        return new PlanGraph(vertices, succ, pred);
    }

    private static void addVertex(String id, List<String> vertices,
                                  Map<String, Set<String>> succ,
                                  Map<String, Set<String>> pred) {
        if (!succ.containsKey(id)) {
            vertices.add(id);
            succ.put(id, new LinkedHashSet<>());
            pred.put(id, new LinkedHashSet<>());
        }
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public List<String> vertices() {
        return vertices;
    }

    public int vertexCount() {
        return vertices.size();
    }

    public Set<String> successors(String id) {
        return Collections.unmodifiableSet(successors.getOrDefault(id, Set.of()));
    }

    public Set<String> predecessors(String id) {
        return Collections.unmodifiableSet(predecessors.getOrDefault(id, Set.of()));
    }

    /** Insertion position of a vertex, -1 if absent. */
    public int indexOf(String id) {
        return order.getOrDefault(id, -1);
    }

    // =========================================================================
    // Components
    // =========================================================================

    /**
     * Weakly-connected components ordered by their smallest insertion index.
     * Members of each component are listed in insertion order.
     */
    public List<List<String>> weaklyConnectedComponents() {
        List<List<String>> components = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        for (String start : vertices) {
            if (seen.contains(start)) continue;

            Set<String> members = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            seen.add(start);

            while (!queue.isEmpty()) {
                String v = queue.poll();
                members.add(v);
                for (String w : neighbours(v)) {
                    if (seen.add(w)) queue.add(w);
                }
            }

            List<String> sorted = new ArrayList<>(members);
            sorted.sort((a, b) -> Integer.compare(indexOf(a), indexOf(b)));
            components.add(sorted);
        }
        // Iteration in insertion order already yields components by minimum index.
        return components;
    }

    public boolean isWeaklyConnected() {
        return vertices.isEmpty() || weaklyConnectedComponents().size() == 1;
    }

    private Set<String> neighbours(String v) {
        Set<String> all = new LinkedHashSet<>(successors.get(v));
        all.addAll(predecessors.get(v));
        return all;
    }
}
