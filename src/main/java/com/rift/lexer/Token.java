package com.rift.lexer;

/**
 * A classified lexeme.
 *
 * @param category Category of the winning rule, or UNKNOWN
 * @param text     Lexeme text
 * @param line     Source line (always 1, no multi-line tracking)
 * @param column   1-based index of the token within its stream
 * @param priority Priority of the winning rule, 0 when unclassified
 */
public record Token(TokenCategory category, String text, int line, int column, int priority) {

    public boolean is(TokenCategory expected) {
        return category == expected;
    }

    @Override
    public String toString() {
        return category + "(" + text + ")";
    }
}
