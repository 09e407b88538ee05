package com.planguard.core.plan;

import java.util.Objects;

/**
 * DependencyEdge — "source must happen before target".
 */
public final class DependencyEdge {

    public static final String DEFAULT_RELATIONSHIP = "depends_on";

    private final String source;
    private final String target;
    private final String relationship;

    public DependencyEdge(String source, String target, String relationship) {
        this.source       = Objects.requireNonNull(source, "source");
        this.target       = Objects.requireNonNull(target, "target");
        this.relationship = relationship != null && !relationship.isBlank()
                ? relationship
                : DEFAULT_RELATIONSHIP;
    }

    public static DependencyEdge of(String source, String target) {
        return new DependencyEdge(source, target, DEFAULT_RELATIONSHIP);
    }

    public String getSource()       { return source; }
    public String getTarget()       { return target; }
    public String getRelationship() { return relationship; }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyEdge)) return false;
        DependencyEdge other = (DependencyEdge) o;
        return source.equals(other.source)
                && target.equals(other.target)
                && relationship.equals(other.relationship);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, relationship);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
