package com.planguard.core.graph;

import com.planguard.core.plan.ActionNode;
import com.planguard.core.plan.Anchors;
import com.planguard.core.plan.DependencyEdge;
import com.planguard.core.plan.Plan;
import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;
import com.planguard.core.verification.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * StructuralRepairer — fixes disconnected and multi-root/multi-terminal plans
 * by linking every component to a single start anchor and a single end anchor.
 *
 * GUARANTEES:
 *   - monotonic: only appends nodes and edges
 *   - deterministic: components are processed by smallest insertion index
 *   - idempotent: an already valid plan comes back unchanged with zero repairs
 *   - cycles are never repaired; the original plan is returned with success=false
 */
public class StructuralRepairer {

    private static final Logger log = LoggerFactory.getLogger(StructuralRepairer.class);

    private final GraphVerifier    verifier;
    private final PlanCanonicalizer canonicalizer;

    public StructuralRepairer() {
        this(new GraphVerifier());
    }

    public StructuralRepairer(GraphVerifier verifier) {
        this.verifier      = verifier;
        this.canonicalizer = new PlanCanonicalizer(verifier);
    }

    public StructuralRepairResult repair(Plan plan) {

        VerificationResult initial = verifier.verify(plan);
        if (initial.isValid()) {
            return StructuralRepairResult.alreadyValid(plan);
        }

        if (plan.isEmpty()) {
            log.info("[Repairer] Empty plan, nothing to repair");
            return StructuralRepairResult.declined(plan, List.of(), initial.getDiagnostics());
        }

        PlanGraph graph = PlanGraph.of(plan);
        if (verifier.topologicalOrder(graph).isEmpty()) {
            log.info("[Repairer] Plan contains a cycle, declining repair");
            return StructuralRepairResult.declined(plan, List.of(), initial.getDiagnostics());
        }

        List<String> repairs = new ArrayList<>();
        List<ActionNode> newNodes = new ArrayList<>();
        List<DependencyEdge> newEdges = new ArrayList<>();

        // Reuse anchors that are already present as nodes
        if (!plan.containsNode(Anchors.START_ID)) {
            newNodes.add(Anchors.start());
            repairs.add("Added virtual start anchor " + Anchors.START_ID);
        } else {
            repairs.add("Reused existing start anchor " + Anchors.START_ID);
        }
        if (!plan.containsNode(Anchors.END_ID)) {
            newNodes.add(Anchors.end());
            repairs.add("Added virtual end anchor " + Anchors.END_ID);
        } else {
            repairs.add("Reused existing end anchor " + Anchors.END_ID);
        }

        Set<String> existingEdges = new HashSet<>();
        for (DependencyEdge e : plan.getEdges()) {
            existingEdges.add(edgeKey(e.getSource(), e.getTarget()));
        }

        List<List<String>> components = graph.weaklyConnectedComponents();
        int rootLinks = 0;
        int terminalLinks = 0;

        for (List<String> component : components) {
            Set<String> members = new HashSet<>(component);
            members.removeIf(Anchors::isAnchorId);

            for (String id : component) {
                if (!members.contains(id)) continue;

                boolean hasInternalPredecessor = graph.predecessors(id).stream().anyMatch(members::contains);
                if (!hasInternalPredecessor && existingEdges.add(edgeKey(Anchors.START_ID, id))) {
                    newEdges.add(DependencyEdge.of(Anchors.START_ID, id));
                    rootLinks++;
                }
            }
            for (String id : component) {
                if (!members.contains(id)) continue;

                boolean hasInternalSuccessor = graph.successors(id).stream().anyMatch(members::contains);
                if (!hasInternalSuccessor && existingEdges.add(edgeKey(id, Anchors.END_ID))) {
                    newEdges.add(DependencyEdge.of(id, Anchors.END_ID));
                    terminalLinks++;
                }
            }
        }

        if (components.size() > 1) {
            repairs.add("Connected " + components.size() + " disconnected components via anchor nodes");
        }
        repairs.add("Linked " + rootLinks + " root node(s) to start anchor");
        repairs.add("Linked " + terminalLinks + " terminal node(s) to end anchor");

        Plan repaired;
        try {
            repaired = plan.withAdditions(newNodes, newEdges);
        } catch (IllegalArgumentException e) {
            log.warn("[Repairer] Repaired plan violates invariants: {}", e.getMessage());
            return StructuralRepairResult.declined(plan, repairs,
                    List.of(Diagnostic.of(Layer.STRUCTURAL, "Repair failed: " + e.getMessage())));
        }

        VerificationResult after = verifier.verify(repaired);
        if (!after.isValid()) {
            log.warn("[Repairer] Repaired plan still invalid: {}", after.messages());
            return StructuralRepairResult.declined(plan, repairs, after.getDiagnostics());
        }

        log.info("[Repairer] Repaired plan: {} component(s), +{} node(s), +{} edge(s)",
                components.size(), newNodes.size(), newEdges.size());
        return StructuralRepairResult.repaired(repaired, repairs);
    }

    /**
     * Repair, then canonicalize the repaired plan. On failure the original
     * plan comes back untouched together with the remaining errors.
     */
    public StructuralRepairResult repairAndCanonicalize(Plan plan) {
        StructuralRepairResult result = repair(plan);
        if (!result.isSuccess()) {
            return result;
        }
        if (result.isOriginalValid()) {
            return StructuralRepairResult.alreadyValid(canonicalizer.canonicalize(plan));
        }
        return StructuralRepairResult.repaired(
                canonicalizer.canonicalize(result.getPlan()), result.getRepairsApplied());
    }

    private static String edgeKey(String source, String target) {
        return source + "\u0000" + target;
    }
}
