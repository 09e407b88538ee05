package com.planguard.core.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ActionNode — one atomic action in a plan graph.
 *
 * Parameters keep the insertion order of the source document; vocabularies
 * fall back to positional lookup when no alias matches, so order matters.
 */
public final class ActionNode {

    private final String              id;
    private final String              actionType;
    private final Map<String, String> params;
    private final String              description;

    /** Set for anchors created by the engine; survives canonical renaming. */
    private final boolean             anchor;

    public ActionNode(String id, String actionType, Map<String, String> params, String description) {
        this(id, actionType, params, description, false);
    }

    ActionNode(String id, String actionType, Map<String, String> params, String description, boolean anchor) {
        this.id          = Objects.requireNonNull(id, "id");
        this.actionType  = actionType != null ? actionType : "";
        this.params      = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
        this.description = description != null ? description : "";
        this.anchor      = anchor || Anchors.isAnchorId(id);
    }

    public static ActionNode of(String id, String actionType) {
        return new ActionNode(id, actionType, Map.of(), "");
    }

    /** Same action under a different id. Used by the canonicalizer. */
    public ActionNode withId(String newId) {
        return new ActionNode(newId, actionType, params, description, anchor);
    }

    public String              getId()          { return id; }
    public String              getActionType()  { return actionType; }
    public Map<String, String> getParams()      { return params; }
    public String              getDescription() { return description; }

    /**
     * True for nodes with a reserved anchor id and for engine anchors renamed
     * by the canonicalizer. A generated node typed "Virtual" is not an anchor.
     */
    public boolean isAnchor() {
        return anchor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActionNode)) return false;
        ActionNode other = (ActionNode) o;
        return id.equals(other.id)
                && actionType.equals(other.actionType)
                && params.equals(other.params)
                && description.equals(other.description)
                && anchor == other.anchor;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, actionType, params, description, anchor);
    }

    @Override
    public String toString() {
        return String.format("ActionNode{id='%s', type='%s', params=%s}", id, actionType, params);
    }
}
