package com.rift.config;

import com.rift.lexer.TokenCategory;

/**
 * Declared token pattern, prior to compilation.
 *
 * @param category Category assigned on match
 * @param pattern  Regular expression, matched against the whole lexeme
 * @param priority Priority; higher wins, earlier declaration wins ties
 */
public record PatternRuleConfig(TokenCategory category, String pattern, int priority) {
}
