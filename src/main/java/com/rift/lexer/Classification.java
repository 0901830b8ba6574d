package com.rift.lexer;

/**
 * Outcome of classifying one lexeme.
 */
public record Classification(TokenCategory category, int priority) {

    public static final Classification UNKNOWN = new Classification(TokenCategory.UNKNOWN, 0);
}
