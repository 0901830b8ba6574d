package com.rift.lexer;

/**
 * Classifies lexemes against an ordered rule list.
 * <p>
 * Every rule is tested. A matching rule replaces the current best only when its
 * priority is strictly greater, so on equal priority the earlier-declared rule wins.
 * Text that matches no rule is UNKNOWN with priority 0.
 */
public final class PatternClassifier {

    private static final int NO_MATCH = -1;

    private PatternClassifier() {
    }

    public static Classification classify(Iterable<PatternRule> rules, String text) {
        TokenCategory bestCategory = TokenCategory.UNKNOWN;
        int bestPriority = NO_MATCH;

        for (PatternRule rule : rules) {
            if (rule.matches(text) && rule.priority() > bestPriority) {
                bestCategory = rule.category();
                bestPriority = rule.priority();
            }
        }

        if (bestPriority == NO_MATCH) {
            return Classification.UNKNOWN;
        }
        return new Classification(bestCategory, bestPriority);
    }
}
