package com.planguard.core.generation;

import java.util.Objects;

/**
 * What the generator plans for: the desired outcome plus what is currently
 * believed about the world. Both are opaque text to the engine.
 */
public final class GoalContext {

    private final String desire;
    private final String beliefs;

    public GoalContext(String desire, String beliefs) {
        this.desire  = Objects.requireNonNull(desire, "desire");
        this.beliefs = beliefs != null ? beliefs : "";
    }

    public static GoalContext of(String desire) {
        return new GoalContext(desire, "");
    }

    public String getDesire()  { return desire; }
    public String getBeliefs() { return beliefs; }

    @Override
    public String toString() {
        return "GoalContext{desire='" + desire + "'}";
    }
}
