package com.rift.lexer;

/**
 * Token categories assigned by the pattern classifier.
 */
public enum TokenCategory {
    IDENTIFIER,
    NUMBER,
    OPERATOR,

    // Declared for a future lexer that does not pre-split on whitespace
    WHITESPACE,

    UNKNOWN
}
