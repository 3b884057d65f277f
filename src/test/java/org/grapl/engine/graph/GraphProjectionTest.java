package org.grapl.engine.graph;

import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.GraplParser;
import org.grapl.dsl.Identifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for node and edge projection of graph expressions.
 */
class GraphProjectionTest {

    private static List<String> nodes(String source) {
        return GraphProjection.nodes(GraplParser.parseExpression(source)).stream()
                .map(Identifier::name)
                .collect(Collectors.toList());
    }

    private static List<String> edges(String source) {
        return GraphProjection.edges(GraplParser.parseExpression(source)).stream()
                .map(Edge::toString)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Nodes")
    class NodeTests {

        @Test
        @DisplayName("Nodes are sorted and distinct")
        void testSortedDistinct() {
            assertEquals(List.of("A", "B", "C"), nodes("[{C, A}, B, {A, B}]"));
        }

        @Test
        @DisplayName("The empty graph has no nodes")
        void testEmpty() {
            assertEquals(List.of(), nodes("[]"));
            assertEquals(List.of(), nodes("{[], {}}"));
        }

        @Test
        @DisplayName("Ordering is by identifier text")
        void testTextOrder() {
            assertEquals(List.of("A", "B", "G10", "G2", "a"), nodes("[a, G2, G10, B, A]"));
        }
    }

    @Nested
    @DisplayName("Edges")
    class EdgeTests {

        @Test
        @DisplayName("A node has no edges")
        void testLeaf() {
            assertEquals(List.of(), edges("A"));
        }

        @Test
        @DisplayName("A clique has both directions of every pair")
        void testClique() {
            assertEquals(List.of("(A, B)", "(A, C)", "(B, A)", "(B, C)", "(C, A)", "(C, B)"), edges("{A, B, C}"));
        }

        @Test
        @DisplayName("Disconnected members are never joined")
        void testDisconnected() {
            assertEquals(List.of(), edges("[A, B, C]"));
            assertEquals(List.of("(A, B)", "(B, A)", "(C, D)", "(D, C)"), edges("[{A, B}, {C, D}]"));
        }

        @Test
        @DisplayName("Connected groups join every node of different members")
        void testDistribution() {
            assertEquals(List.of("(A, B)", "(A, C)", "(B, A)", "(C, A)"), edges("{A, [B, C]}"));
        }

        @Test
        @DisplayName("Repeated nodes do not form self loops")
        void testNoSelfLoops() {
            assertEquals(List.of(), edges("{A, A}"));
            assertEquals(List.of("(A, B)", "(B, A)"), edges("{A, [A, B]}"));
        }

        @Test
        @DisplayName("Edge ordering is by source then target")
        void testEdgeOrder() {
            assertTrue(Edge.of("A", "B").compareTo(Edge.of("B", "A")) < 0);
            assertTrue(Edge.of("A", "B").compareTo(Edge.of("A", "C")) < 0);
            assertEquals(Edge.of("B", "A"), Edge.of("A", "B").reversed());
        }

        @Test
        @DisplayName("Self loops cannot be built")
        void testSelfLoopRejected() {
            assertThrows(IllegalArgumentException.class, () -> Edge.of("A", "A"));
        }
    }

    @Test
    @DisplayName("containsNode finds nodes at any depth")
    void testContainsNode() {
        GraphExpression expr = GraplParser.parseExpression("{X, [A, {B, [C]}]}");

        assertTrue(GraphProjection.containsNode(expr, new Identifier("X")));
        assertTrue(GraphProjection.containsNode(expr, new Identifier("C")));
        assertFalse(GraphProjection.containsNode(expr, new Identifier("D")));
        assertFalse(GraphProjection.containsNode(GraplParser.parseExpression("[]"), new Identifier("A")));
    }
}
