package com.planguard.core.plan;

import java.util.Map;

/**
 * Reserved virtual nodes used to unify disconnected fragments and
 * multiple roots/terminals. A plan holds at most one node per anchor id.
 */
public final class Anchors {

    public static final String START_ID    = "__START__";
    public static final String END_ID      = "__END__";
    public static final String ACTION_TYPE = "Virtual";

    private Anchors() {}

    public static ActionNode start() {
        return new ActionNode(START_ID, ACTION_TYPE, Map.of(), "Virtual start node (plan initialization)", true);
    }

    public static ActionNode end() {
        return new ActionNode(END_ID, ACTION_TYPE, Map.of(), "Virtual end node (plan completion)", true);
    }

    public static boolean isAnchorId(String id) {
        return START_ID.equals(id) || END_ID.equals(id);
    }
}
