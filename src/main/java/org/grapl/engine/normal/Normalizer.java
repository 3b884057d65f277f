package org.grapl.engine.normal;

import org.grapl.dsl.Assignment;
import org.grapl.dsl.Connected;
import org.grapl.dsl.Disconnected;
import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.Identifier;
import org.grapl.dsl.Leaf;
import org.grapl.dsl.Program;
import org.grapl.engine.graph.GraphProjection;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Rewrites graph expressions into normal form: a disjoint union of cliques.
 * 
 * Reductions:
 * - Empty graphs are fully disconnected: {} => []
 * - Single member groups are their member: [{A}] => A
 * - Nested groups of the same kind are flattened: {{A, B}, C} => {A, B, C}
 * - Connected groups distribute over disconnected members, like AND over OR
 * when building a disjunctive normal form:
 * {[A, B], [C, D]} => [{A, C}, {A, D}, {B, C}, {B, D}]
 * - Components contained in a sibling are dropped:
 * [{A, B}, {A, B, C}] => {A, B, C}
 * 
 * A normal form is a Leaf, a Connected of two or more distinct leaves, or a
 * Disconnected whose components are such leaves and cliques, none of them a
 * subset of another. Normalization is idempotent. Its cost grows with the
 * cross product of the disconnected members of connected groups.
 */
public final class Normalizer {

    private Normalizer() {
        // Static utility class
    }

    /**
     * Normalizes an expression.
     * 
     * @param expr Any well-formed expression
     * @return The normal form of the expression
     */
    public static GraphExpression normalize(GraphExpression expr) {
        if (expr instanceof Leaf) {
            return expr;
        }
        if (expr instanceof Connected connected) {
            return normalizeConnected(connected);
        }
        return normalizeDisconnected((Disconnected) expr);
    }

    /**
     * Normalizes the right-hand side of an assignment.
     */
    public static Assignment normalize(Assignment assignment) {
        return new Assignment(assignment.name(), normalize(assignment.value()));
    }

    /**
     * Normalizes every assignment of a program and its result expression.
     */
    public static Program normalize(Program program) {
        List<Assignment> assignments = new ArrayList<>(program.assignments().size());
        for (Assignment assignment : program.assignments()) {
            assignments.add(normalize(assignment));
        }
        return new Program(assignments, normalize(program.result()));
    }

    /**
     * [A, [B, C], {D, E}] => [A, B, C, {D, E}]
     */
    private static GraphExpression normalizeDisconnected(Disconnected disconnected) {
        List<GraphExpression> components = new ArrayList<>();
        for (GraphExpression member : disconnected.members()) {
            GraphExpression normal = normalize(member);
            if (normal instanceof Disconnected nested) {
                components.addAll(nested.members());
            } else {
                components.add(normal);
            }
        }
        return reduce(components, Disconnected::new);
    }

    /**
     * Distributes the group over its members' branches:
     * 
     * <pre>
     * {A, [B, C], D, [E, F]}
     * combinations [[A]]
     *           => [[A, B], [A, C]]
     *           => [[A, B, D], [A, C, D]]
     *           => [[A, B, D, E], [A, B, D, F], [A, C, D, E], [A, C, D, F]]
     * </pre>
     */
    private static GraphExpression normalizeConnected(Connected connected) {
        List<List<Leaf>> combinations = new ArrayList<>();
        combinations.add(List.of());

        for (GraphExpression member : connected.members()) {
            GraphExpression normal = normalize(member);
            // An empty graph adds nothing to the group
            if (normal instanceof Disconnected disconnected && disconnected.isEmpty()) {
                continue;
            }
            List<List<Leaf>> branches = branches(normal);
            List<List<Leaf>> next = new ArrayList<>(combinations.size() * branches.size());
            for (List<Leaf> combination : combinations) {
                for (List<Leaf> branch : branches) {
                    List<Leaf> extended = new ArrayList<>(combination.size() + branch.size());
                    extended.addAll(combination);
                    extended.addAll(branch);
                    next.add(extended);
                }
            }
            combinations = next;
        }

        List<GraphExpression> cliques = new ArrayList<>(combinations.size());
        for (List<Leaf> combination : combinations) {
            if (!combination.isEmpty()) {
                cliques.add(clique(combination));
            }
        }
        return reduce(cliques, Disconnected::new);
    }

    /**
     * Lists the alternative leaf sets of a normalized expression. A leaf or a
     * clique is one branch; a disconnected group has one branch per component.
     */
    private static List<List<Leaf>> branches(GraphExpression normal) {
        if (normal instanceof Disconnected disconnected) {
            List<List<Leaf>> branches = new ArrayList<>(disconnected.members().size());
            for (GraphExpression component : disconnected.members()) {
                branches.add(leaves(component));
            }
            return branches;
        }
        return List.of(leaves(normal));
    }

    private static List<Leaf> leaves(GraphExpression component) {
        if (component instanceof Leaf leaf) {
            return List.of(leaf);
        }
        if (component instanceof Connected clique) {
            List<Leaf> leaves = new ArrayList<>(clique.members().size());
            for (GraphExpression member : clique.members()) {
                leaves.add((Leaf) member);
            }
            return leaves;
        }
        throw new IllegalStateException("Not a normal component: " + component);
    }

    private static GraphExpression clique(List<Leaf> leaves) {
        Set<Leaf> distinct = new LinkedHashSet<>(leaves);
        return reduce(new ArrayList<GraphExpression>(distinct), Connected::new);
    }

    /**
     * Removes subsumed siblings and collapses the group.
     * 
     * A sibling is dropped when its node set is a strict subset of another
     * sibling's, or equal to the node set of an earlier sibling. A single
     * survivor replaces the group; no survivors give the empty graph.
     * 
     * @param siblings Normalized components of one group
     * @param regroup  Builds the group kind being rebuilt
     */
    static GraphExpression reduce(List<GraphExpression> siblings,
            Function<List<GraphExpression>, GraphExpression> regroup) {
        List<GraphExpression> kept = deduplicate(siblings);
        if (kept.isEmpty()) {
            return Disconnected.empty();
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return regroup.apply(kept);
    }

    static List<GraphExpression> deduplicate(List<GraphExpression> siblings) {
        if (siblings.size() < 2) {
            return siblings;
        }
        List<Set<Identifier>> nodeSets = new ArrayList<>(siblings.size());
        for (GraphExpression sibling : siblings) {
            nodeSets.add(GraphProjection.nodes(sibling));
        }

        List<GraphExpression> kept = new ArrayList<>(siblings.size());
        for (int i = 0; i < siblings.size(); i++) {
            if (!isSubsumed(i, nodeSets)) {
                kept.add(siblings.get(i));
            }
        }
        return kept;
    }

    private static boolean isSubsumed(int index, List<Set<Identifier>> nodeSets) {
        Set<Identifier> candidate = nodeSets.get(index);
        for (int j = 0; j < nodeSets.size(); j++) {
            if (j == index) {
                continue;
            }
            Set<Identifier> other = nodeSets.get(j);
            if (other.size() < candidate.size() || !other.containsAll(candidate)) {
                continue;
            }
            if (other.size() > candidate.size() || j < index) {
                return true;
            }
        }
        return false;
    }
}
