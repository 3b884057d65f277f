package org.grapl.dsl;

import java.util.Objects;

/**
 * Bare expression statement whose value is printed.
 */
public record Evaluation(GraphExpression expression) implements Statement {

    public Evaluation {
        Objects.requireNonNull(expression, "Expression cannot be null");
    }
}
