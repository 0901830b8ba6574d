package com.rift.lexer;

import com.rift.config.RiftConfig;
import com.rift.config.DefaultGovernance;
import com.rift.config.Stage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PatternClassifier.
 */
class PatternClassifierTest {

    private PatternRuleSet defaultRules;

    @BeforeEach
    void setUp() {
        defaultRules = new DefaultGovernance(RiftConfig.defaults()).getPatternRules(Stage.TOKENIZER);
    }

    @ParameterizedTest
    @CsvSource({
            "x, IDENTIFIER, 100",
            "_tmp1, IDENTIFIER, 100",
            "42, NUMBER, 90",
            "3.14, NUMBER, 90",
            "+, OPERATOR, 80",
            "*, OPERATOR, 80",
            "'!', OPERATOR, 80",
            "1abc, UNKNOWN, 0",
            "++, UNKNOWN, 0",
            "3., UNKNOWN, 0"
    })
    @DisplayName("Default rules classify lexemes by highest matching priority")
    void classifiesWithDefaultRules(String text, TokenCategory category, int priority) {
        Classification result = PatternClassifier.classify(defaultRules, text);

        assertEquals(category, result.category());
        assertEquals(priority, result.priority());
    }

    @Test
    @DisplayName("Higher priority rule declared later wins")
    void laterHigherPriorityWins() {
        PatternRuleSet rules = PatternRuleSet.builder()
                .rule(TokenCategory.IDENTIFIER, "^[a-z]+$", 10)
                .rule(TokenCategory.OPERATOR, "^[a-z]+$", 20)
                .build();

        Classification result = PatternClassifier.classify(rules, "abc");

        assertEquals(TokenCategory.OPERATOR, result.category());
        assertEquals(20, result.priority());
    }

    @Test
    @DisplayName("Later lower priority rule does not mask an earlier match")
    void laterLowerPriorityDoesNotMask() {
        PatternRuleSet rules = PatternRuleSet.builder()
                .rule(TokenCategory.NUMBER, "^\\d+$", 90)
                .rule(TokenCategory.IDENTIFIER, "^\\w+$", 5)
                .build();

        assertEquals(TokenCategory.NUMBER, PatternClassifier.classify(rules, "12").category());
        assertEquals(TokenCategory.IDENTIFIER, PatternClassifier.classify(rules, "ab").category());
    }

    @Test
    @DisplayName("On equal priority the earlier-declared rule wins")
    void tieGoesToEarlierRule() {
        PatternRuleSet identifierFirst = PatternRuleSet.builder()
                .rule(TokenCategory.IDENTIFIER, "^[a-z]+$", 50)
                .rule(TokenCategory.OPERATOR, "^[a-z]+$", 50)
                .build();
        PatternRuleSet operatorFirst = PatternRuleSet.builder()
                .rule(TokenCategory.OPERATOR, "^[a-z]+$", 50)
                .rule(TokenCategory.IDENTIFIER, "^[a-z]+$", 50)
                .build();

        assertEquals(TokenCategory.IDENTIFIER, PatternClassifier.classify(identifierFirst, "abc").category());
        assertEquals(TokenCategory.OPERATOR, PatternClassifier.classify(operatorFirst, "abc").category());
    }

    @Test
    @DisplayName("Malformed pattern is excluded without affecting other rules")
    void malformedPatternNeverMatches() {
        PatternRuleSet rules = PatternRuleSet.builder()
                .rule(TokenCategory.NUMBER, "^[0-9", 99)
                .rule(TokenCategory.NUMBER, "^\\d+$", 40)
                .build();

        assertEquals(1, rules.compileErrors().size());
        assertEquals("^[0-9", rules.compileErrors().get(0).getPattern());
        assertEquals(2, rules.size());

        Classification result = PatternClassifier.classify(rules, "7");
        assertEquals(TokenCategory.NUMBER, result.category());
        assertEquals(40, result.priority());
    }

    @Test
    @DisplayName("Text matching no rule is UNKNOWN with priority 0")
    void noMatchIsUnknown() {
        PatternRuleSet empty = PatternRuleSet.builder().build();

        assertEquals(Classification.UNKNOWN, PatternClassifier.classify(empty, "x"));
        assertEquals(Classification.UNKNOWN, PatternClassifier.classify(defaultRules, "#"));
    }

    @Test
    @DisplayName("Patterns match the whole lexeme")
    void matchingIsAnchored() {
        PatternRuleSet rules = PatternRuleSet.builder()
                .rule(TokenCategory.NUMBER, "\\d+", 90)
                .build();

        assertEquals(TokenCategory.NUMBER, PatternClassifier.classify(rules, "123").category());
        assertEquals(TokenCategory.UNKNOWN, PatternClassifier.classify(rules, "123a").category());
    }

    @Test
    @DisplayName("Custom matcher can replace the regex engine")
    void customMatcher() {
        PatternRuleSet rules = PatternRuleSet.builder()
                .rule(TokenCategory.OPERATOR, "len==1", text -> text.length() == 1, 5)
                .build();

        assertEquals(TokenCategory.OPERATOR, PatternClassifier.classify(rules, "%").category());
        assertEquals(TokenCategory.UNKNOWN, PatternClassifier.classify(rules, "%%").category());
    }

    @Test
    @DisplayName("Rule sequence numbers are scoped to each rule set")
    void sequenceNumbersArePerRuleSet() {
        PatternRuleSet first = PatternRuleSet.builder()
                .rule(TokenCategory.IDENTIFIER, "a", 1)
                .rule(TokenCategory.NUMBER, "1", 1)
                .build();
        PatternRuleSet second = PatternRuleSet.builder()
                .rule(TokenCategory.OPERATOR, "\\+", 1)
                .build();

        assertEquals(0, first.rules().get(0).sequence());
        assertEquals(1, first.rules().get(1).sequence());
        assertEquals(0, second.rules().get(0).sequence());
    }
}
