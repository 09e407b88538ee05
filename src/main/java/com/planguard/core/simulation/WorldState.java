package com.planguard.core.simulation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * WorldState — blocksworld relations at one point of a replay.
 *
 * Immutable; every transition returns a new state, so an action's effect is
 * a total function of (state, action).
 */
public final class WorldState {

    /** "block is directly on below". */
    public static final class On {
        private final String block;
        private final String below;

        public On(String block, String below) {
            this.block = Objects.requireNonNull(block, "block");
            this.below = Objects.requireNonNull(below, "below");
        }

        public String getBlock() { return block; }
        public String getBelow() { return below; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof On)) return false;
            On other = (On) o;
            return block.equals(other.block) && below.equals(other.below);
        }

        @Override
        public int hashCode() {
            return Objects.hash(block, below);
        }

        @Override
        public String toString() {
            return "(on " + block + " " + below + ")";
        }
    }

    private final Set<String> onTable;
    private final Set<String> clear;
    private final Set<On>     on;
    private final String      holding;

    private WorldState(Set<String> onTable, Set<String> clear, Set<On> on, String holding) {
        this.onTable = Collections.unmodifiableSet(new LinkedHashSet<>(onTable));
        this.clear   = Collections.unmodifiableSet(new LinkedHashSet<>(clear));
        this.on      = Collections.unmodifiableSet(new LinkedHashSet<>(on));
        this.holding = holding;
    }

    public static WorldState empty() {
        return new WorldState(Set.of(), Set.of(), Set.of(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public Set<String>      getOnTable() { return onTable; }
    public Set<String>      getClear()   { return clear; }
    public Set<On>          getOn()      { return on; }
    public Optional<String> getHolding() { return Optional.ofNullable(holding); }

    public boolean isOnTable(String block)           { return onTable.contains(block); }
    public boolean isClear(String block)             { return clear.contains(block); }
    public boolean isOn(String block, String below)  { return on.contains(new On(block, below)); }
    public boolean isHandEmpty()                     { return holding == null; }
    public boolean isHolding(String block)           { return block.equals(holding); }

    // =========================================================================
    // Transitions
    // =========================================================================

    public WorldState withOnTable(String block, boolean present) {
        return new WorldState(toggle(onTable, block, present), clear, on, holding);
    }

    public WorldState withClear(String block, boolean present) {
        return new WorldState(onTable, toggle(clear, block, present), on, holding);
    }

    public WorldState withOn(String block, String below, boolean present) {
        return new WorldState(onTable, clear, toggle(on, new On(block, below), present), holding);
    }

    /** @param block block now held, or null for an empty hand */
    public WorldState withHolding(String block) {
        return new WorldState(onTable, clear, on, block);
    }

    private static <T> Set<T> toggle(Set<T> set, T value, boolean present) {
        Set<T> copy = new LinkedHashSet<>(set);
        if (present) copy.add(value);
        else         copy.remove(value);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorldState)) return false;
        WorldState other = (WorldState) o;
        return onTable.equals(other.onTable)
                && clear.equals(other.clear)
                && on.equals(other.on)
                && Objects.equals(holding, other.holding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(onTable, clear, on, holding);
    }

    @Override
    public String toString() {
        return String.format("WorldState{onTable=%s, clear=%s, on=%s, holding=%s}",
                onTable, clear, on, holding);
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final Set<String> onTable = new LinkedHashSet<>();
        private final Set<String> clear   = new LinkedHashSet<>();
        private final Set<On>     on      = new LinkedHashSet<>();
        private String            holding = null;

        private Builder() {}

        public Builder onTable(String... blocks)          { Collections.addAll(onTable, blocks); return this; }
        public Builder onTable(Collection<String> blocks) { onTable.addAll(blocks);              return this; }
        public Builder clear(String... blocks)            { Collections.addAll(clear, blocks);   return this; }
        public Builder clear(Collection<String> blocks)   { clear.addAll(blocks);                return this; }
        public Builder on(String block, String below)     { on.add(new On(block, below));        return this; }
        public Builder holding(String block)              { this.holding = block;                return this; }

        public WorldState build() {
            return new WorldState(onTable, clear, on, holding);
        }
    }
}
