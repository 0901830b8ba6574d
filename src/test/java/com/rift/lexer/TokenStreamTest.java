package com.rift.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenStream.
 */
class TokenStreamTest {

    private static Token token(int column) {
        return new Token(TokenCategory.IDENTIFIER, "t" + column, 1, column, 100);
    }

    @Test
    @DisplayName("New stream is empty with default capacity")
    void newStreamIsEmpty() {
        TokenStream stream = new TokenStream();

        assertTrue(stream.isEmpty());
        assertEquals(0, stream.size());
        assertEquals(TokenStream.DEFAULT_CAPACITY, stream.capacity());
    }

    @Test
    @DisplayName("Growth doubles capacity and keeps every token")
    void growthPreservesTokens() {
        TokenStream stream = new TokenStream(2);
        for (int i = 1; i <= 25; i++) {
            stream.append(token(i));
        }

        assertEquals(25, stream.size());
        assertEquals(32, stream.capacity());
        for (int i = 1; i <= 25; i++) {
            Token t = stream.get(i - 1);
            assertEquals("t" + i, t.text());
            assertEquals(i, t.column());
        }
    }

    @Test
    @DisplayName("Iteration follows insertion order")
    void iteratesInOrder() {
        TokenStream stream = new TokenStream();
        for (int i = 1; i <= 12; i++) {
            stream.append(token(i));
        }

        List<Integer> columns = new ArrayList<>();
        for (Token t : stream) {
            columns.add(t.column());
        }

        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12), columns);
        assertEquals(12, stream.toList().size());
    }

    @Test
    @DisplayName("Out of range access is rejected")
    void outOfRangeAccess() {
        TokenStream stream = new TokenStream();
        stream.append(token(1));

        assertThrows(IndexOutOfBoundsException.class, () -> stream.get(1));
        assertThrows(IndexOutOfBoundsException.class, () -> stream.get(-1));
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TokenStream(0));
        assertThrows(IllegalArgumentException.class, () -> new TokenStream().append(null));
    }
}
