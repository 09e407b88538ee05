package com.planguard.core.domain;

import com.planguard.core.domain.ActionSignature.Slot;

import java.util.Optional;

/**
 * Blocksworld: pick-up, put-down, stack, unstack.
 */
public final class BlocksworldVocabulary extends AliasingVocabulary {

    public static final String PICK_UP  = "pick-up";
    public static final String PUT_DOWN = "put-down";
    public static final String STACK    = "stack";
    public static final String UNSTACK  = "unstack";

    static final BlocksworldVocabulary INSTANCE = new BlocksworldVocabulary();

    private BlocksworldVocabulary() {
        Slot block  = new Slot("block", "block", "object", "obj", "x");
        Slot onto   = new Slot("target", "target", "y", "to", "on", "onto", "destination");
        Slot from   = new Slot("from", "from", "target", "y", "on", "source", "underneath");

        register(new ActionSignature(PICK_UP, block));
        register(new ActionSignature(PUT_DOWN, block));
        register(new ActionSignature(STACK, block, onto));
        register(new ActionSignature(UNSTACK, block, from));
    }

    @Override
    public PlanningDomain domain() {
        return PlanningDomain.BLOCKSWORLD;
    }

    @Override
    public Optional<String> canonicalName(String actionType) {
        String t = squash(actionType);
        if (t.equals("pickup"))        return Optional.of(PICK_UP);
        if (t.equals("putdown"))       return Optional.of(PUT_DOWN);
        // "unstack" contains "stack": test it first
        if (t.startsWith("unstack"))   return Optional.of(UNSTACK);
        if (t.startsWith("stack"))     return Optional.of(STACK);
        return Optional.empty();
    }
}
