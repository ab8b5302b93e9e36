package com.grandchess.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SquareTest {

    @Test
    void shouldLabelWideFilesWithTwoLetters() {
        assertEquals("a", Square.fileLabel(0));
        assertEquals("z", Square.fileLabel(25));
        assertEquals("aa", Square.fileLabel(26));
        assertEquals("az", Square.fileLabel(51));
        assertEquals("ba", Square.fileLabel(52));
        assertEquals("cu", Square.fileLabel(98));
    }

    @Test
    void shouldParseAlgebraicNames() {
        assertEquals(new Square(4, 3), Square.parse("e4"));
        assertEquals(new Square(26, 11), Square.parse("aa12"));
        assertEquals("aa12", new Square(26, 11).toNotation());
    }

    @Test
    void shouldRejectMalformedNames() {
        assertThrows(IllegalArgumentException.class, () -> Square.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Square.parse("e"));
        assertThrows(IllegalArgumentException.class, () -> Square.parse("4e"));
    }
}
