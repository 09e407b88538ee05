package com.planguard.core.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Named, ordered parameter slots of one action, each with the parameter keys
 * generators use for it.
 */
public final class ActionSignature {

    /** One argument position and the map keys that may carry it. */
    public static final class Slot {
        private final String       role;
        private final List<String> aliases;

        public Slot(String role, String... aliases) {
            this.role    = role;
            this.aliases = List.of(aliases);
        }

        public String       getRole()    { return role; }
        public List<String> getAliases() { return aliases; }
    }

    private final String     name;
    private final List<Slot> slots;

    public ActionSignature(String name, Slot... slots) {
        this.name  = name;
        this.slots = Arrays.asList(slots);
    }

    public String     getName()  { return name; }
    public List<Slot> getSlots() { return slots; }

    public int arity() {
        return slots.size();
    }

    /** e.g. "stack(block, target)", used when describing the vocabulary in prompts. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append("(");
        for (int i = 0; i < slots.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(slots.get(i).getRole());
        }
        return sb.append(")").toString();
    }
}
