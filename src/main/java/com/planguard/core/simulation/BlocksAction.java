package com.planguard.core.simulation;

import com.planguard.core.domain.BlocksworldVocabulary;
import com.planguard.core.domain.GroundAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * BlocksAction — one blocksworld action with typed arguments.
 *
 * Subclasses list violated preconditions against a state and compute the
 * effect. Effects are defined for every state, including states that
 * violate the preconditions.
 */
public abstract class BlocksAction {

    /** Human-readable violated preconditions; empty when applicable. */
    public abstract List<String> violations(WorldState state);

    public abstract WorldState apply(WorldState state);

    /**
     * Typed action for a ground action, empty for unknown names or a wrong
     * argument count.
     */
    public static Optional<BlocksAction> from(GroundAction action) {
        List<String> a = action.getArguments();
        switch (action.getName()) {
            case BlocksworldVocabulary.PICK_UP:
                return a.size() == 1 ? Optional.of(new PickUp(a.get(0))) : Optional.empty();
            case BlocksworldVocabulary.PUT_DOWN:
                return a.size() == 1 ? Optional.of(new PutDown(a.get(0))) : Optional.empty();
            case BlocksworldVocabulary.STACK:
                return a.size() == 2 ? Optional.of(new Stack(a.get(0), a.get(1))) : Optional.empty();
            case BlocksworldVocabulary.UNSTACK:
                return a.size() == 2 ? Optional.of(new Unstack(a.get(0), a.get(1))) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static String held(WorldState state) {
        return state.getHolding().orElse("nothing");
    }

    // =========================================================================
    // pick-up ?x : clear x, ontable x, handempty
    // =========================================================================

    public static final class PickUp extends BlocksAction {
        private final String block;

        public PickUp(String block) { this.block = block; }

        public String getBlock() { return block; }

        @Override
        public List<String> violations(WorldState state) {
            List<String> out = new ArrayList<>();
            if (!state.isClear(block)) {
                out.add("Cannot pick-up " + block + " - block not clear (something on top)");
            }
            if (!state.isHandEmpty()) {
                out.add("Cannot pick-up " + block + " - hand already holding " + held(state));
            }
            if (!state.isOnTable(block)) {
                out.add("Cannot pick-up " + block + " - not on table");
            }
            return out;
        }

        @Override
        public WorldState apply(WorldState state) {
            return state.withOnTable(block, false)
                    .withClear(block, false)
                    .withHolding(block);
        }

        @Override
        public String toString() { return "(pick-up " + block + ")"; }
    }

    // =========================================================================
    // put-down ?x : holding x
    // =========================================================================

    public static final class PutDown extends BlocksAction {
        private final String block;

        public PutDown(String block) { this.block = block; }

        public String getBlock() { return block; }

        @Override
        public List<String> violations(WorldState state) {
            if (state.isHolding(block)) return List.of();
            return List.of("Cannot put-down " + block + " - not holding it (holding " + held(state) + ")");
        }

        @Override
        public WorldState apply(WorldState state) {
            return state.withOnTable(block, true)
                    .withClear(block, true)
                    .withHolding(null);
        }

        @Override
        public String toString() { return "(put-down " + block + ")"; }
    }

    // =========================================================================
    // stack ?x ?y : holding x, clear y
    // =========================================================================

    public static final class Stack extends BlocksAction {
        private final String block;
        private final String target;

        public Stack(String block, String target) {
            this.block  = block;
            this.target = target;
        }

        public String getBlock()  { return block; }
        public String getTarget() { return target; }

        @Override
        public List<String> violations(WorldState state) {
            List<String> out = new ArrayList<>();
            if (!state.isHolding(block)) {
                out.add("Cannot stack " + block + " - not holding it (holding " + held(state) + ")");
            }
            if (!state.isClear(target)) {
                out.add("Cannot stack on " + target + " - not clear");
            }
            return out;
        }

        @Override
        public WorldState apply(WorldState state) {
            return state.withOn(block, target, true)
                    .withClear(block, true)
                    .withClear(target, false)
                    .withHolding(null);
        }

        @Override
        public String toString() { return "(stack " + block + " " + target + ")"; }
    }

    // =========================================================================
    // unstack ?x ?y : on x y, clear x, handempty
    // =========================================================================

    public static final class Unstack extends BlocksAction {
        private final String block;
        private final String from;

        public Unstack(String block, String from) {
            this.block = block;
            this.from  = from;
        }

        public String getBlock() { return block; }
        public String getFrom()  { return from; }

        @Override
        public List<String> violations(WorldState state) {
            List<String> out = new ArrayList<>();
            if (!state.isOn(block, from)) {
                out.add("Cannot unstack " + block + " from " + from + " - " + block + " is not on " + from);
            }
            if (!state.isClear(block)) {
                out.add("Cannot unstack " + block + " - not clear");
            }
            if (!state.isHandEmpty()) {
                out.add("Cannot unstack " + block + " - hand not empty (holding " + held(state) + ")");
            }
            return out;
        }

        @Override
        public WorldState apply(WorldState state) {
            return state.withOn(block, from, false)
                    .withClear(from, true)
                    .withClear(block, false)
                    .withHolding(block);
        }

        @Override
        public String toString() { return "(unstack " + block + " " + from + ")"; }
    }
}
