package com.rift.config;

import com.rift.lexer.TokenCategory;
import com.rift.render.OutputFormat;
import com.rift.render.OutputSettings;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root governance configuration: one optional section per stage.
 *
 * @param name    Governance profile name
 * @param version Configuration version
 * @param stages  Stage configurations keyed by stage
 */
public record RiftConfig(String name, String version, Map<Stage, StageConfig> stages) {

    public static final String DEFAULT_VERSION = "1.0.0";

    public RiftConfig {
        EnumMap<Stage, StageConfig> copy = new EnumMap<>(Stage.class);
        if (stages != null) {
            copy.putAll(stages);
        }
        stages = Collections.unmodifiableMap(copy);
    }

    public Optional<StageConfig> getStage(Stage stage) {
        return Optional.ofNullable(stages.get(stage));
    }

    /**
     * Built-in governance: the standard arithmetic token patterns, precedence
     * table, pass flags and output formats.
     */
    public static RiftConfig defaults() {
        List<PatternRuleConfig> patterns = List.of(
                new PatternRuleConfig(TokenCategory.IDENTIFIER, "^[a-zA-Z_]\\w*$", 100),
                new PatternRuleConfig(TokenCategory.NUMBER, "^\\d+(\\.\\d+)?$", 90),
                new PatternRuleConfig(TokenCategory.OPERATOR, "^[+\\-*/=<>!&|]$", 80),
                new PatternRuleConfig(TokenCategory.WHITESPACE, "^\\s+$", 10)
        );

        Map<String, Integer> precedence = new LinkedHashMap<>();
        precedence.put("*", 20);
        precedence.put("/", 20);
        precedence.put("+", 10);
        precedence.put("-", 10);

        Map<String, Boolean> passes = new LinkedHashMap<>();
        passes.put("constant_folding", true);
        passes.put("dead_code_elimination", true);
        passes.put("common_subexpression_elimination", false);

        OutputSettings output = new OutputSettings(OutputFormat.LISP_STYLE_AST, OutputFormat.C_CODE,
                OutputFormat.DOT_GRAPH, true);

        Map<Stage, StageConfig> stages = new EnumMap<>(Stage.class);
        stages.put(Stage.TOKENIZER, StageConfig.tokenizer(patterns));
        stages.put(Stage.PARSER, StageConfig.parser(precedence));
        stages.put(Stage.COORDINATOR, StageConfig.coordinator(passes));
        stages.put(Stage.RENDERER, StageConfig.renderer(output));
        return new RiftConfig("rift-default", DEFAULT_VERSION, stages);
    }
}
