package org.grapl.engine.normal;

import org.grapl.dsl.Assignment;
import org.grapl.dsl.Connected;
import org.grapl.dsl.Disconnected;
import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.GraplParser;
import org.grapl.dsl.Leaf;
import org.grapl.dsl.Program;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.grapl.engine.test.ComponentSets.assertNormal;
import static org.grapl.engine.test.ComponentSets.assertSameNormalForm;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reduction of graph expressions to normal form.
 */
class NormalizerTest {

    private static GraphExpression normalize(String source) {
        return Normalizer.normalize(GraplParser.parseExpression(source));
    }

    @Nested
    @DisplayName("Collapsing")
    class CollapseTests {

        @Test
        @DisplayName("A node is already normal")
        void testNode() {
            assertEquals(Leaf.of("A"), normalize("A"));
        }

        @Test
        @DisplayName("Empty groups are the empty disconnected graph")
        void testEmptyGroups() {
            assertEquals(Disconnected.empty(), normalize("[]"));
            assertEquals(Disconnected.empty(), normalize("{}"));
            assertEquals(Disconnected.empty(), normalize("[{}]"));
            assertEquals(Disconnected.empty(), normalize("{[], []}"));
            assertEquals(Disconnected.empty(), normalize("[[], {[]}]"));
            assertTrue(((Disconnected) normalize("{[], {}}")).isEmpty());
        }

        @Test
        @DisplayName("Single member groups collapse to the member")
        void testSingleMember() {
            assertEquals(Leaf.of("A"), normalize("{A}"));
            assertEquals(Leaf.of("A"), normalize("[A]"));
            assertEquals(Leaf.of("A"), normalize("{{A}}"));
            assertEquals(Leaf.of("A"), normalize("[[A]]"));
            assertEquals(Leaf.of("A"), normalize("{[A]}"));
            assertEquals(Leaf.of("A"), normalize("[{[{A}]}]"));
        }

        @Test
        @DisplayName("Empty members of a connected group add nothing")
        void testEmptyMemberOfConnected() {
            assertEquals(Leaf.of("A"), normalize("{A, []}"));
            assertEquals(Connected.of(Leaf.of("A"), Leaf.of("B")), normalize("{A, {}, B, [[]]}"));
        }
    }

    @Nested
    @DisplayName("Flattening")
    class FlattenTests {

        @Test
        @DisplayName("Nested disconnected groups are spliced")
        void testNestedDisconnected() {
            assertEquals(GraplParser.parseExpression("[A, B, C, D]"), normalize("[A, [B, C], D]"));
            assertEquals(GraplParser.parseExpression("[A, {B, C}, D]"), normalize("[A, [{B, C}], D]"));
            assertEquals(GraplParser.parseExpression("[A, {B, C}, D]"), normalize("[A, {B, C}, D]"));
        }

        @Test
        @DisplayName("Nested connected groups are merged")
        void testNestedConnected() {
            assertEquals(GraplParser.parseExpression("{A, B, C}"), normalize("{{A, B}, C}"));
            assertEquals(GraplParser.parseExpression("{A, B}"), normalize("{A, [B]}"));
            assertEquals(GraplParser.parseExpression("[A, B]"), normalize("[A, {B}]"));
        }
    }

    @Nested
    @DisplayName("Distribution")
    class DistributionTests {

        @Test
        @DisplayName("Connected distributes over a disconnected member")
        void testSimpleDistribution() {
            assertSameNormalForm("[{A, B}, {A, C}]", normalize("{A, [B, C]}"));
        }

        @Test
        @DisplayName("Clique members join every branch")
        void testCliqueMember() {
            assertSameNormalForm("[{A, B, C}, {A, B, D}]", normalize("{{A, B}, [C, D]}"));
            assertSameNormalForm("[{A, B, C}, {A, B, D}]", normalize("{A, {B, [C, D]}}"));
            assertSameNormalForm("[{A, B, D}, {A, C, D}]", normalize("{A, [B, C], D}"));
        }

        @Test
        @DisplayName("Two disconnected members give their cross product")
        void testCrossProduct() {
            assertSameNormalForm("[{A, C}, {A, D}, {B, C}, {B, D}]", normalize("{[A, B], [C, D]}"));
        }

        @Test
        @DisplayName("Clique components of a disconnected member stay together")
        void testCliqueInsideDisconnected() {
            assertSameNormalForm("[{A, B, C, E}, {A, D, E}]", normalize("{A, [{B, C}, D], E}"));
            assertSameNormalForm(
                    "[{A, B, C, E, F}, {A, D, E, F}, {A, B, C, E, G}, {A, D, E, G}]",
                    normalize("{A, [{B, C}, D], E, [F, G]}"));
        }

        @Test
        @DisplayName("Two disconnected members give every pairing of their branches")
        void testBranchPairs() {
            assertSameNormalForm("[{A, C}, {A, D}, {B, C}, {B, D}]", normalize("{[A, B], [C, D]}"));
        }
    }

    @Nested
    @DisplayName("Deduplication")
    class DeduplicationTests {

        @Test
        @DisplayName("Subsumed members of a connected group merge into one clique")
        void testConnectedContext() {
            assertEquals(GraplParser.parseExpression("{A, B, C, D, E}"),
                    normalize("{{A, B}, {A, B, C}, A, {C, D}, {C, D, E}}"));
        }

        @Test
        @DisplayName("Subsumed components of a disconnected group are dropped")
        void testDisconnectedContext() {
            assertSameNormalForm("[{A, B, C}, {C, D, E}]",
                    normalize("[{A, B}, {A, B, C}, A, {C, D}, {C, D, E}]"));
        }

        @Test
        @DisplayName("Equal components keep the first")
        void testDuplicateComponents() {
            assertEquals(GraplParser.parseExpression("[{A, B}, C]"), normalize("[{A, B}, C, {B, A}, C]"));
            assertEquals(Leaf.of("A"), normalize("[A, A]"));
            assertEquals(Leaf.of("A"), normalize("{A, A}"));
        }

        @Test
        @DisplayName("Distribution can produce subsumed cliques")
        void testAfterDistribution() {
            assertEquals(GraplParser.parseExpression("{A, B}"), normalize("{A, [B, {A, B}]}"));
            assertEquals(GraplParser.parseExpression("{A, B}"), normalize("{[A, B], [A, B]}"));
            assertSameNormalForm("[{A, B}, {A, C}]", normalize("{A, [B, C, A]}"));
        }
    }

    @Nested
    @DisplayName("Statements")
    class StatementTests {

        @Test
        @DisplayName("Assignments normalize their value")
        void testAssignment() {
            Assignment assignment = Normalizer.normalize(GraplParser.parseAssignment("G2 = [[{{D}}]]"));
            assertEquals(Assignment.of("G2", Leaf.of("D")), assignment);
        }

        @Test
        @DisplayName("Programs normalize every assignment and the result")
        void testProgram() {
            Program program = Normalizer.normalize(GraplParser.parseProgram("""
                    G1 = {A, [B, C]}
                    [[{{D}}]]
                    """));

            assertEquals(1, program.assignments().size());
            assertEquals(GraplParser.parseExpression("[{A, B}, {A, C}]"), program.assignments().get(0).value());
            assertEquals(Leaf.of("D"), program.result());
        }
    }

    @Test
    @DisplayName("Results satisfy the normal form invariants")
    void testNormalFormShape() {
        for (String source : List.of(
                "{A, [{B, C}, D], E, [F, G]}",
                "[{A, B}, {A, B, C}, A, {C, D}, {C, D, E}]",
                "{[A, {B, [C, D]}], [E, [F, {A, B}]]}",
                "[{}, {A}, [B, [C, {C, D}]]]")) {
            GraphExpression normal = normalize(source);
            assertNormal(normal);
            assertEquals(normal, Normalizer.normalize(normal), "Not idempotent for " + source);
        }
    }
}
