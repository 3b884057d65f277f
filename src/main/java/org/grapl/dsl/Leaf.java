package org.grapl.dsl;

import java.util.Objects;

/**
 * Single node expression: A
 */
public record Leaf(Identifier id) implements GraphExpression {

    public Leaf {
        Objects.requireNonNull(id, "Leaf identifier cannot be null");
    }

    public static Leaf of(String name) {
        return new Leaf(new Identifier(name));
    }
}
