package org.grapl.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Connected group: {A, B, ...}
 * 
 * Every member is adjacent to every other member. Member order is kept as
 * written but carries no meaning once the expression is normalized.
 * 
 * @param members The grouped expressions
 */
public record Connected(List<GraphExpression> members) implements GraphExpression {

    public Connected {
        Objects.requireNonNull(members, "Members cannot be null");
        members = List.copyOf(members);
    }

    public static Connected of(GraphExpression... members) {
        return new Connected(List.of(members));
    }
}
