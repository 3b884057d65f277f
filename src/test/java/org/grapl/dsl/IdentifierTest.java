package org.grapl.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierTest {

    @Test
    @DisplayName("Identifiers start with a letter or underscore")
    void testValidation() {
        assertTrue(Identifier.isValid("A"));
        assertTrue(Identifier.isValid("_g1"));
        assertTrue(Identifier.isValid("Node42"));
        assertFalse(Identifier.isValid("1A"));
        assertFalse(Identifier.isValid(""));
        assertFalse(Identifier.isValid("A-B"));
        assertFalse(Identifier.isValid(null));
        assertThrows(IllegalArgumentException.class, () -> new Identifier("9"));
        assertThrows(NullPointerException.class, () -> new Identifier(null));
    }

    @Test
    @DisplayName("Equality and ordering follow the text")
    void testOrdering() {
        assertEquals(new Identifier("A"), Identifier.of("A"));
        assertTrue(Identifier.of("A").compareTo(Identifier.of("B")) < 0);
        assertTrue(Identifier.of("Z").compareTo(Identifier.of("a")) < 0);
        assertEquals("G1", Identifier.of("G1").toString());
    }

    @Test
    @DisplayName("Groups own an immutable copy of their members")
    void testMemberCopy() {
        java.util.List<GraphExpression> members = new java.util.ArrayList<>();
        members.add(Leaf.of("A"));
        Connected connected = new Connected(members);
        members.add(Leaf.of("B"));

        assertEquals(1, connected.members().size());
        assertThrows(UnsupportedOperationException.class, () -> connected.members().add(Leaf.of("C")));
    }
}
