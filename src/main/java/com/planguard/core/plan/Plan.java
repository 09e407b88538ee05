package com.planguard.core.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Plan — immutable action-dependency graph as produced by the generator.
 *
 * INVARIANTS (checked at construction):
 *   - node ids are unique
 *   - every edge endpoint names a node of this plan or an anchor id
 *
 * Node insertion order is preserved; component ordering in the structural
 * repairer depends on it. Plans are only ever extended through
 * {@link #withAdditions(List, List)}, never mutated.
 */
public final class Plan {

    private final String                  goalDescription;
    private final List<ActionNode>        nodes;
    private final List<DependencyEdge>    edges;
    private final Map<String, ActionNode> index;

    public Plan(String goalDescription, List<ActionNode> nodes, List<DependencyEdge> edges) {
        this.goalDescription = goalDescription != null ? goalDescription : "";
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();

        Map<String, ActionNode> byId = new LinkedHashMap<>();
        for (ActionNode node : this.nodes) {
            if (byId.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            }
        }
        for (DependencyEdge edge : this.edges) {
            checkEndpoint(byId, edge.getSource(), edge);
            checkEndpoint(byId, edge.getTarget(), edge);
        }
        this.index = Collections.unmodifiableMap(byId);
    }

    private static void checkEndpoint(Map<String, ActionNode> byId, String id, DependencyEdge edge) {
        if (!byId.containsKey(id) && !Anchors.isAnchorId(id)) {
            throw new IllegalArgumentException(
                    "Edge " + edge + " references unknown node '" + id + "'");
        }
    }

    public static Plan empty(String goalDescription) {
        return new Plan(goalDescription, List.of(), List.of());
    }

    /**
     * New plan with the given nodes and edges appended after the existing
     * ones. Existing nodes and edges keep their positions.
     */
    public Plan withAdditions(List<ActionNode> extraNodes, List<DependencyEdge> extraEdges) {
        List<ActionNode> allNodes = new ArrayList<>(nodes);
        allNodes.addAll(extraNodes);
        List<DependencyEdge> allEdges = new ArrayList<>(edges);
        allEdges.addAll(extraEdges);
        return new Plan(goalDescription, allNodes, allEdges);
    }

    public String               getGoalDescription() { return goalDescription; }
    public List<ActionNode>     getNodes()           { return nodes; }
    public List<DependencyEdge> getEdges()           { return edges; }

    public Optional<ActionNode> findNode(String id) {
        return Optional.ofNullable(index.get(id));
    }

    public boolean containsNode(String id) {
        return index.containsKey(id);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plan)) return false;
        Plan other = (Plan) o;
        return goalDescription.equals(other.goalDescription)
                && nodes.equals(other.nodes)
                && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(goalDescription, nodes, edges);
    }

    @Override
    public String toString() {
        return String.format("Plan{goal='%s', nodes=%d, edges=%d}",
                goalDescription, nodes.size(), edges.size());
    }
}
