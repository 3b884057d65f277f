package org.grapl.engine.graph;

import org.grapl.dsl.Identifier;

import java.util.Comparator;
import java.util.Objects;

/**
 * An ordered pair of adjacent nodes. Adjacency is symmetric, so every
 * undirected edge is reported once in each direction.
 * 
 * @param from Source node
 * @param to   Target node
 */
public record Edge(Identifier from, Identifier to) implements Comparable<Edge> {

    private static final Comparator<Edge> ORDER = Comparator.comparing(Edge::from).thenComparing(Edge::to);

    public Edge {
        Objects.requireNonNull(from, "Edge source cannot be null");
        Objects.requireNonNull(to, "Edge target cannot be null");
        if (from.equals(to)) {
            throw new IllegalArgumentException("Self loop on " + from);
        }
    }

    public static Edge of(String from, String to) {
        return new Edge(new Identifier(from), new Identifier(to));
    }

    public Edge reversed() {
        return new Edge(to, from);
    }

    @Override
    public int compareTo(Edge other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + from + ", " + to + ")";
    }
}
