package org.grapl.engine.graph;

import org.grapl.dsl.Connected;
import org.grapl.dsl.Disconnected;
import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.Identifier;
import org.grapl.dsl.Leaf;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Derives the node and edge sets denoted by a graph expression.
 * 
 * Projection works on any expression tree, normalized or not, and gives the
 * same sets for an expression and its normal form:
 * - a Leaf is one node and no edges
 * - a Disconnected group is the union of its members
 * - a Connected group is the union of its members plus an edge between every
 * two nodes taken from two different members
 * 
 * Results are sorted by identifier text.
 */
public final class GraphProjection {

    private GraphProjection() {
        // Static utility class
    }

    /**
     * @return All node identifiers reachable in the expression
     */
    public static SortedSet<Identifier> nodes(GraphExpression expr) {
        SortedSet<Identifier> nodes = new TreeSet<>();
        collectNodes(expr, nodes);
        return nodes;
    }

    /**
     * @return Every adjacent pair, in both directions, without self loops
     */
    public static SortedSet<Edge> edges(GraphExpression expr) {
        SortedSet<Edge> edges = new TreeSet<>();
        collectEdges(expr, edges);
        return edges;
    }

    /**
     * Tests whether a node occurs anywhere in the expression.
     */
    public static boolean containsNode(GraphExpression expr, Identifier id) {
        if (expr instanceof Leaf leaf) {
            return leaf.id().equals(id);
        }
        for (GraphExpression member : members(expr)) {
            if (containsNode(member, id)) {
                return true;
            }
        }
        return false;
    }

    private static void collectNodes(GraphExpression expr, SortedSet<Identifier> nodes) {
        if (expr instanceof Leaf leaf) {
            nodes.add(leaf.id());
            return;
        }
        for (GraphExpression member : members(expr)) {
            collectNodes(member, nodes);
        }
    }

    /**
     * Adds the edges of the expression and returns its nodes.
     */
    private static SortedSet<Identifier> collectEdges(GraphExpression expr, SortedSet<Edge> edges) {
        if (expr instanceof Leaf leaf) {
            SortedSet<Identifier> single = new TreeSet<>();
            single.add(leaf.id());
            return single;
        }

        List<SortedSet<Identifier>> memberNodes = new ArrayList<>();
        SortedSet<Identifier> nodes = new TreeSet<>();
        for (GraphExpression member : members(expr)) {
            SortedSet<Identifier> current = collectEdges(member, edges);
            memberNodes.add(current);
            nodes.addAll(current);
        }

        if (expr instanceof Connected) {
            for (int i = 0; i < memberNodes.size(); i++) {
                for (int j = i + 1; j < memberNodes.size(); j++) {
                    join(memberNodes.get(i), memberNodes.get(j), edges);
                }
            }
        }
        return nodes;
    }

    private static void join(SortedSet<Identifier> left, SortedSet<Identifier> right, SortedSet<Edge> edges) {
        for (Identifier a : left) {
            for (Identifier b : right) {
                if (!a.equals(b)) {
                    edges.add(new Edge(a, b));
                    edges.add(new Edge(b, a));
                }
            }
        }
    }

    private static List<GraphExpression> members(GraphExpression expr) {
        if (expr instanceof Connected connected) {
            return connected.members();
        }
        if (expr instanceof Disconnected disconnected) {
            return disconnected.members();
        }
        return List.of();
    }
}
