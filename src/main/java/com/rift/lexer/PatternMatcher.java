package com.rift.lexer;

/**
 * Capability for testing a whole lexeme against a token pattern.
 * Implementations must use full-string (anchored) semantics.
 */
@FunctionalInterface
public interface PatternMatcher {

    /**
     * Check whether the entire text matches.
     */
    boolean matches(String text);

    /**
     * Matcher used in place of a rule whose pattern failed to compile.
     */
    static PatternMatcher never() {
        return text -> false;
    }
}
