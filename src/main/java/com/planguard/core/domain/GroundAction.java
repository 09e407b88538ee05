package com.planguard.core.domain;

import java.util.List;
import java.util.Objects;

/**
 * GroundAction — canonical action name with its ordered arguments,
 * e.g. {@code stack [a, b]} rendered as {@code (stack a b)}.
 */
public final class GroundAction {

    private final String       name;
    private final List<String> arguments;

    public GroundAction(String name, List<String> arguments) {
        this.name      = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
    }

    public String       getName()      { return name; }
    public List<String> getArguments() { return arguments; }

    public int arity() {
        return arguments.size();
    }

    public String argument(int i) {
        return arguments.get(i);
    }

    /** One parenthesized action token, the plan-file line format. */
    public String toLine() {
        if (arguments.isEmpty()) return "(" + name + ")";
        return "(" + name + " " + String.join(" ", arguments) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroundAction)) return false;
        GroundAction other = (GroundAction) o;
        return name.equals(other.name) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return toLine();
    }
}
