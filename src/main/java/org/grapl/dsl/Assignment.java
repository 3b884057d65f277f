package org.grapl.dsl;

import java.util.Objects;

/**
 * Assignment statement: G = {A, B}
 * 
 * The value is bound when the statement is resolved, not lazily.
 * 
 * @param name  The bound name
 * @param value The right-hand side expression
 */
public record Assignment(Identifier name, GraphExpression value) implements Statement {

    public Assignment {
        Objects.requireNonNull(name, "Assignment name cannot be null");
        Objects.requireNonNull(value, "Assignment value cannot be null");
    }

    public static Assignment of(String name, GraphExpression value) {
        return new Assignment(new Identifier(name), value);
    }
}
