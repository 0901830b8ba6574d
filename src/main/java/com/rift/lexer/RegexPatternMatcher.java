package com.rift.lexer;

import com.rift.exception.PatternCompileException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * PatternMatcher backed by java.util.regex.
 */
public final class RegexPatternMatcher implements PatternMatcher {

    private final Pattern pattern;

    private RegexPatternMatcher(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Compile a regular expression.
     *
     * @throws PatternCompileException if the expression is malformed
     */
    public static RegexPatternMatcher compile(String regex) {
        if (regex == null) {
            throw new PatternCompileException("null", new IllegalArgumentException("pattern is null"));
        }
        try {
            return new RegexPatternMatcher(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new PatternCompileException(regex, e);
        }
    }

    @Override
    public boolean matches(String text) {
        return text != null && pattern.matcher(text).matches();
    }

    @Override
    public String toString() {
        return "/" + pattern.pattern() + "/";
    }
}
