package com.planguard.core.graph;

import com.planguard.core.plan.Plan;
import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;
import com.planguard.core.verification.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * GraphVerifier — structural checks on a plan graph.
 *
 * Check order:
 *   1. Emptiness: fail fast, nothing else is checked
 *   2. Weak connectivity: one diagnostic, checking continues
 *   3. Acyclicity: one diagnostic per simple cycle
 *
 * Stateless; safe to share between threads.
 */
public class GraphVerifier {

    private static final Logger log = LoggerFactory.getLogger(GraphVerifier.class);

    public static final String EMPTY_MESSAGE        = "Plan is empty (no actions generated).";
    public static final String DISCONNECTED_MESSAGE =
            "Plan graph is disconnected. All actions should be related to the goal.";
    public static final String CYCLE_PREFIX         = "Cycle detected: ";

    /** Upper bound on enumerated cycles; dense graphs can hold exponentially many. */
    static final int MAX_REPORTED_CYCLES = 256;

    public VerificationResult verify(Plan plan) {
        return verify(PlanGraph.of(plan));
    }

    public VerificationResult verify(PlanGraph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (graph.vertexCount() == 0) {
            diagnostics.add(Diagnostic.of(Layer.STRUCTURAL, EMPTY_MESSAGE));
            return VerificationResult.of(diagnostics);
        }

        if (!graph.isWeaklyConnected()) {
            diagnostics.add(Diagnostic.of(Layer.STRUCTURAL, DISCONNECTED_MESSAGE));
        }

        for (List<String> cycle : simpleCycles(graph)) {
            diagnostics.add(Diagnostic.of(Layer.STRUCTURAL,
                    CYCLE_PREFIX + String.join(" -> ", cycle)));
        }

        if (!diagnostics.isEmpty()) {
            log.debug("[GraphVerifier] {} structural issue(s) in {} vertices",
                    diagnostics.size(), graph.vertexCount());
        }
        return VerificationResult.of(diagnostics);
    }

    public boolean hasCycle(Plan plan) {
        PlanGraph graph = PlanGraph.of(plan);
        return graph.vertexCount() > 0 && topologicalOrder(graph).isEmpty();
    }

    // =========================================================================
    // Topological order
    // =========================================================================

    /**
     * Linear order honoring every edge, ties broken by insertion order.
     * Empty when the graph is empty or cyclic.
     */
    public List<String> topologicalOrder(Plan plan) {
        return topologicalOrder(PlanGraph.of(plan));
    }

    public List<String> topologicalOrder(PlanGraph graph) {
        int n = graph.vertexCount();
        int[] inDegree = new int[n];
        for (String v : graph.vertices()) {
            inDegree[graph.indexOf(v)] = graph.predecessors(v).size();
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) ready.add(i);
        }

        List<String> result = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            String v = graph.vertices().get(ready.poll());
            result.add(v);
            for (String w : graph.successors(v)) {
                int wi = graph.indexOf(w);
                if (--inDegree[wi] == 0) ready.add(wi);
            }
        }

        if (result.size() != n) {
            return List.of();
        }
        return result;
    }

    // =========================================================================
    // Cycle enumeration
    // =========================================================================

    /**
     * Every simple cycle, each reported once starting at its member with the
     * smallest insertion index. A self-loop is a cycle of length one.
     *
     * Johnson's algorithm: for each start vertex s, the search is confined to
     * the strongly connected component of s among vertices ordered at or after
     * s, and vertices that cannot reach s stay blocked until a cycle through
     * them is found. Work is O((V+E)(C+1)) for C cycles reported.
     */
    List<List<String>> simpleCycles(PlanGraph graph) {
        List<List<String>> cycles = new ArrayList<>();
        if (!topologicalOrder(graph).isEmpty()) {
            return cycles;
        }

        for (String start : graph.vertices()) {
            if (cycles.size() >= MAX_REPORTED_CYCLES) {
                log.warn("[GraphVerifier] Cycle enumeration stopped at {} cycles", MAX_REPORTED_CYCLES);
                break;
            }
            Set<String> component = componentFrom(graph, start);
            if (component.size() == 1 && !graph.successors(start).contains(start)) {
                continue;
            }
            new CircuitSearch(graph, start, component, cycles).circuit(start);
        }
        return cycles;
    }

    /** Vertices at or after {@code start} that both reach and are reached from it. */
    private static Set<String> componentFrom(PlanGraph graph, String start) {
        int startIndex = graph.indexOf(start);
        Set<String> forward  = reachable(graph, start, startIndex, true);
        Set<String> backward = reachable(graph, start, startIndex, false);
        forward.retainAll(backward);
        return forward;
    }

    private static Set<String> reachable(PlanGraph graph, String from, int minIndex, boolean forward) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        seen.add(from);
        stack.push(from);
        while (!stack.isEmpty()) {
            String v = stack.pop();
            for (String w : forward ? graph.successors(v) : graph.predecessors(v)) {
                if (graph.indexOf(w) >= minIndex && seen.add(w)) {
                    stack.push(w);
                }
            }
        }
        return seen;
    }

    private static final class CircuitSearch {

        private final PlanGraph graph;
        private final String start;
        private final Set<String> component;
        private final List<List<String>> cycles;

        private final List<String> path = new ArrayList<>();
        private final Set<String> blocked = new HashSet<>();
        private final Map<String, Set<String>> blockedBy = new HashMap<>();

        CircuitSearch(PlanGraph graph, String start, Set<String> component, List<List<String>> cycles) {
            this.graph = graph;
            this.start = start;
            this.component = component;
            this.cycles = cycles;
        }

        boolean circuit(String v) {
            boolean found = false;
            path.add(v);
            blocked.add(v);

            for (String w : graph.successors(v)) {
                if (cycles.size() >= MAX_REPORTED_CYCLES) break;
                if (!component.contains(w)) continue;

                if (w.equals(start)) {
                    cycles.add(List.copyOf(path));
                    found = true;
                } else if (!blocked.contains(w) && circuit(w)) {
                    found = true;
                }
            }

            if (found) {
                unblock(v);
            } else {
                for (String w : graph.successors(v)) {
                    if (component.contains(w)) {
                        blockedBy.computeIfAbsent(w, k -> new HashSet<>()).add(v);
                    }
                }
            }
            path.remove(path.size() - 1);
            return found;
        }

        private void unblock(String v) {
            Deque<String> pending = new ArrayDeque<>();
            pending.push(v);
            while (!pending.isEmpty()) {
                String u = pending.pop();
                if (!blocked.remove(u)) continue;
                Set<String> waiting = blockedBy.remove(u);
                if (waiting != null) {
                    waiting.forEach(pending::push);
                }
            }
        }
    }
}
