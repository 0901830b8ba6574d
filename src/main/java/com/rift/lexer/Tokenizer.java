package com.rift.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Stage 0: splits source text on whitespace and classifies each lexeme.
 */
public final class Tokenizer {

    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    private static final Pattern DELIMITER = Pattern.compile("\\s+");
    private static final int LINE = 1;

    private final PatternRuleSet rules;

    public Tokenizer(PatternRuleSet rules) {
        if (rules == null) {
            throw new IllegalArgumentException("Rule set cannot be null");
        }
        this.rules = rules;
        log.info("Tokenizer initialized with {} pattern rules ({} excluded as malformed)",
                rules.size(), rules.compileErrors().size());
    }

    /**
     * Tokenize the input.
     *
     * @param input Source text; null is treated as empty
     * @return Stream of classified tokens in source order
     */
    public TokenStream tokenize(String input) {
        TokenStream stream = new TokenStream();
        if (input == null) {
            return stream;
        }

        for (String lexeme : DELIMITER.split(input)) {
            if (lexeme.isEmpty()) {
                continue;
            }
            Classification classification = PatternClassifier.classify(rules, lexeme);
            Token token = new Token(classification.category(), lexeme, LINE,
                    stream.size() + 1, classification.priority());
            stream.append(token);
            log.debug("Token '{}' classified as {} (priority: {})",
                    lexeme, token.category(), token.priority());
        }

        log.debug("Tokenization complete: {} tokens", stream.size());
        return stream;
    }

    public PatternRuleSet getRules() {
        return rules;
    }
}
