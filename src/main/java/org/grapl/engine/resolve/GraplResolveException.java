package org.grapl.engine.resolve;

import org.grapl.dsl.Identifier;

/**
 * Exception thrown when an assignment breaks the active binding policy.
 * Only the offending statement fails; the environment is left unchanged.
 */
public class GraplResolveException extends RuntimeException {

    public enum Violation {
        /** The name is already bound and shadowing is not allowed */
        SHADOWING,
        /** The binding refers to its own name and recursion is not allowed */
        RECURSION
    }

    private final Violation violation;
    private final Identifier name;

    public GraplResolveException(Violation violation, Identifier name) {
        super(describe(violation, name));
        this.violation = violation;
        this.name = name;
    }

    private static String describe(Violation violation, Identifier name) {
        return switch (violation) {
            case SHADOWING -> "Shadowing: '" + name + "' is already bound";
            case RECURSION -> "Recursion: '" + name + "' refers to itself";
        };
    }

    public Violation getViolation() {
        return violation;
    }

    public Identifier getName() {
        return name;
    }
}
