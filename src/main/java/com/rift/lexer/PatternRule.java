package com.rift.lexer;

/**
 * A compiled classification rule.
 *
 * @param pattern  Source pattern text
 * @param matcher  Compiled matcher (never-matching if the pattern was malformed)
 * @param category Category assigned on match
 * @param priority Rule priority; higher wins
 * @param sequence Declaration index within the owning rule set
 */
public record PatternRule(String pattern, PatternMatcher matcher, TokenCategory category, int priority, int sequence) {

    public boolean matches(String text) {
        return matcher.matches(text);
    }
}
