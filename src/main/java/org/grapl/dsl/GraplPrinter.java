package org.grapl.dsl;

import org.grapl.engine.normal.Normalizer;

import java.util.List;

/**
 * Renders Grapl trees back to source text.
 * 
 * {@link #print} renders a tree as it stands; the {@code printCanonical}
 * methods render the normal form, so equal graphs print the same text up to
 * component order.
 */
public final class GraplPrinter {

    private GraplPrinter() {
        // Static utility class
    }

    public static String print(GraphExpression expr) {
        StringBuilder sb = new StringBuilder();
        append(expr, sb);
        return sb.toString();
    }

    public static String printCanonical(GraphExpression expr) {
        return print(Normalizer.normalize(expr));
    }

    /**
     * G = [{A, B}, {A, C}]
     */
    public static String printCanonical(Assignment assignment) {
        return assignment.name() + " = " + printCanonical(assignment.value());
    }

    /**
     * One assignment per line, then the result expression.
     */
    public static String printCanonical(Program program) {
        StringBuilder sb = new StringBuilder();
        for (Assignment assignment : program.assignments()) {
            sb.append(printCanonical(assignment)).append('\n');
        }
        sb.append(printCanonical(program.result()));
        return sb.toString();
    }

    private static void append(GraphExpression expr, StringBuilder sb) {
        if (expr instanceof Leaf leaf) {
            sb.append(leaf.id().name());
        } else if (expr instanceof Connected connected) {
            appendGroup('{', connected.members(), '}', sb);
        } else if (expr instanceof Disconnected disconnected) {
            appendGroup('[', disconnected.members(), ']', sb);
        }
    }

    private static void appendGroup(char open, List<GraphExpression> members, char close, StringBuilder sb) {
        sb.append(open);
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            append(members.get(i), sb);
        }
        sb.append(close);
    }
}
