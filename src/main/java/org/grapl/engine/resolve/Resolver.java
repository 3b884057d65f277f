package org.grapl.engine.resolve;

import org.grapl.dsl.Assignment;
import org.grapl.dsl.Connected;
import org.grapl.dsl.Disconnected;
import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.Identifier;
import org.grapl.dsl.Leaf;
import org.grapl.dsl.Program;
import org.grapl.engine.graph.GraphProjection;

import java.util.ArrayList;
import java.util.List;

/**
 * Substitutes bound names with their expressions.
 * 
 * <pre>
 * G = [A, B]
 * {X, G}
 * =>
 * {X, [A, B]}
 * </pre>
 * 
 * Unbound names stay as nodes. Resolution does not normalize.
 * 
 * A binding only counts as recursive when its right-hand side names the bound
 * identifier directly and the name survives substitution. Under shadowing,
 * {@code G1 = G2} then {@code G2 = G1} binds G2 to G2 without a recursion
 * violation: the self reference only appears through G1's earlier binding.
 */
public final class Resolver {

    private Resolver() {
        // Static utility class
    }

    public static GraphExpression resolve(GraphExpression expr, Environment environment) {
        if (expr instanceof Leaf leaf) {
            return environment.lookup(leaf.id());
        }
        if (expr instanceof Connected connected) {
            return new Connected(resolveAll(connected.members(), environment));
        }
        Disconnected disconnected = (Disconnected) expr;
        return new Disconnected(resolveAll(disconnected.members(), environment));
    }

    /**
     * Resolves the right-hand side against the current bindings and binds the
     * name to the result.
     * 
     * @return The assignment with its resolved value
     * @throws GraplResolveException on a shadowing or recursion violation
     */
    public static Assignment resolve(Assignment assignment, Environment environment) {
        Identifier name = assignment.name();
        GraphExpression resolved = resolve(assignment.value(), environment);
        boolean selfReferential = GraphProjection.containsNode(assignment.value(), name)
                && GraphProjection.containsNode(resolved, name);
        environment.bind(name, resolved, selfReferential);
        return new Assignment(name, resolved);
    }

    /**
     * Resolves assignments in order. The first violation aborts the rest.
     */
    public static List<Assignment> resolve(List<Assignment> assignments, Environment environment) {
        List<Assignment> resolved = new ArrayList<>(assignments.size());
        for (Assignment assignment : assignments) {
            resolved.add(resolve(assignment, environment));
        }
        return resolved;
    }

    /**
     * Resolves every assignment, then the program's result expression.
     * 
     * @return The resolved result expression
     */
    public static GraphExpression resolve(Program program, Environment environment) {
        resolve(program.assignments(), environment);
        return resolve(program.result(), environment);
    }

    private static List<GraphExpression> resolveAll(List<GraphExpression> members, Environment environment) {
        List<GraphExpression> resolved = new ArrayList<>(members.size());
        for (GraphExpression member : members) {
            resolved.add(resolve(member, environment));
        }
        return resolved;
    }
}
