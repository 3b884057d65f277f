package org.grapl.dsl;

import java.util.List;
import java.util.Objects;

/**
 * A Grapl program: a sequence of assignments followed by the expression
 * the program evaluates to.
 * 
 * <pre>
 * G1 = [A, B]
 * G2 = {X, G1}
 * G2
 * </pre>
 * 
 * @param assignments The assignments, in source order
 * @param result      The trailing expression
 */
public record Program(List<Assignment> assignments, GraphExpression result) {

    public Program {
        Objects.requireNonNull(assignments, "Assignments cannot be null");
        Objects.requireNonNull(result, "Result expression cannot be null");
        assignments = List.copyOf(assignments);
    }
}
