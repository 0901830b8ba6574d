package com.rift.lexer;

import com.rift.exception.PatternCompileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable, ordered set of pattern rules. Declaration order is significant:
 * it breaks priority ties during classification.
 */
public final class PatternRuleSet implements Iterable<PatternRule> {

    private static final Logger log = LoggerFactory.getLogger(PatternRuleSet.class);

    private final List<PatternRule> rules;
    private final List<PatternCompileException> compileErrors;

    private PatternRuleSet(List<PatternRule> rules, List<PatternCompileException> compileErrors) {
        this.rules = Collections.unmodifiableList(rules);
        this.compileErrors = Collections.unmodifiableList(compileErrors);
    }

    public List<PatternRule> rules() {
        return rules;
    }

    /**
     * Errors for rules whose pattern could not be compiled.
     * Those rules are present in the set but never match.
     */
    public List<PatternCompileException> compileErrors() {
        return compileErrors;
    }

    public int size() {
        return rules.size();
    }

    @Override
    public Iterator<PatternRule> iterator() {
        return rules.iterator();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder that assigns sequence numbers from its own counter.
     */
    public static final class Builder {

        private final List<PatternRule> rules = new ArrayList<>();
        private final List<PatternCompileException> errors = new ArrayList<>();
        private int nextSequence = 0;

        private Builder() {
        }

        public Builder rule(TokenCategory category, String pattern, int priority) {
            PatternMatcher matcher;
            try {
                matcher = RegexPatternMatcher.compile(pattern);
            } catch (PatternCompileException e) {
                log.warn("Excluding {} rule from classification: {}", category, e.getMessage());
                errors.add(e);
                matcher = PatternMatcher.never();
            }
            return rule(category, pattern, matcher, priority);
        }

        public Builder rule(TokenCategory category, String pattern, PatternMatcher matcher, int priority) {
            if (category == null) {
                throw new IllegalArgumentException("Rule category cannot be null");
            }
            rules.add(new PatternRule(pattern, matcher, category, priority, nextSequence++));
            return this;
        }

        public PatternRuleSet build() {
            return new PatternRuleSet(new ArrayList<>(rules), new ArrayList<>(errors));
        }
    }
}
