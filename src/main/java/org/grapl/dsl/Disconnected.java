package org.grapl.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Disconnected group: [A, B, ...]
 * 
 * A disjoint union: no edge joins two different members. The empty
 * disconnected group is the canonical empty graph.
 * 
 * @param members The grouped expressions
 */
public record Disconnected(List<GraphExpression> members) implements GraphExpression {

    private static final Disconnected EMPTY = new Disconnected(List.of());

    public Disconnected {
        Objects.requireNonNull(members, "Members cannot be null");
        members = List.copyOf(members);
    }

    public static Disconnected of(GraphExpression... members) {
        return new Disconnected(List.of(members));
    }

    /**
     * @return The empty graph
     */
    public static Disconnected empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }
}
