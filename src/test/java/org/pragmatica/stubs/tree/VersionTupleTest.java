package org.pragmatica.stubs.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VersionTupleTest {

    @Test
    void parse_dottedVersion_splitsComponents() {
        var version = VersionTuple.parse("3.8.1");

        assertEquals(List.of(3, 8, 1), version.parts());
        assertEquals(3, version.size());
    }

    @Test
    void parse_malformedVersion_throws() {
        assertThrows(IllegalArgumentException.class, () -> VersionTuple.parse("3.x"));
        assertThrows(IllegalArgumentException.class, () -> VersionTuple.parse("3..8"));
        assertThrows(IllegalArgumentException.class, () -> VersionTuple.parse(""));
    }

    @Test
    void of_negativeComponent_throws() {
        assertThrows(IllegalArgumentException.class, () -> VersionTuple.of(3, -1));
        assertThrows(IllegalArgumentException.class, VersionTuple::of);
    }

    @Test
    void compareTo_padsShorterTupleWithZeros() {
        assertEquals(0, VersionTuple.of(3).compareTo(VersionTuple.of(3, 0, 0)));
        assertTrue(VersionTuple.of(3).compareTo(VersionTuple.of(3, 0, 1)) < 0);
        assertTrue(VersionTuple.of(3, 10).compareTo(VersionTuple.of(3, 9)) > 0);
        assertTrue(VersionTuple.of(2, 7, 18).compareTo(VersionTuple.of(3)) < 0);
    }

    @Test
    void toString_matchesTupleSyntax() {
        assertEquals("(3, 8)", VersionTuple.of(3, 8).toString());
        assertEquals("(3,)", VersionTuple.of(3).toString());
    }
}
