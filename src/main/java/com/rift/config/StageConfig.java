package com.rift.config;

import com.rift.render.OutputSettings;

import java.util.List;
import java.util.Map;

/**
 * Configuration of one pipeline stage. Sections not used by the stage are null.
 *
 * @param stage              Stage this configuration belongs to
 * @param stageName          Display name (e.g., "TOKENIZER")
 * @param spAlignment        Processing alignment label (e.g., "LEXICAL_ANALYSIS")
 * @param governanceVersion  Version of the governance document
 * @param tokenPatterns      Ordered token pattern rules (tokenizer)
 * @param precedenceTable    Operator symbol to precedence level (parser)
 * @param optimizationPasses Pass name to enablement (coordinator)
 * @param outputFormats      Output format selection (renderer)
 */
public record StageConfig(
        Stage stage,
        String stageName,
        String spAlignment,
        String governanceVersion,
        List<PatternRuleConfig> tokenPatterns,
        Map<String, Integer> precedenceTable,
        Map<String, Boolean> optimizationPasses,
        OutputSettings outputFormats
) {
    public static StageConfig tokenizer(List<PatternRuleConfig> tokenPatterns) {
        return new StageConfig(Stage.TOKENIZER, "TOKENIZER", "LEXICAL_ANALYSIS", RiftConfig.DEFAULT_VERSION,
                tokenPatterns, null, null, null);
    }

    public static StageConfig parser(Map<String, Integer> precedenceTable) {
        return new StageConfig(Stage.PARSER, "PARSER_BRIDGE", "SYNTACTIC_ANALYSIS", RiftConfig.DEFAULT_VERSION,
                null, precedenceTable, null, null);
    }

    public static StageConfig coordinator(Map<String, Boolean> optimizationPasses) {
        return new StageConfig(Stage.COORDINATOR, "AST_COORDINATOR", "SEMANTIC_ANALYSIS", RiftConfig.DEFAULT_VERSION,
                null, null, optimizationPasses, null);
    }

    public static StageConfig renderer(OutputSettings outputFormats) {
        return new StageConfig(Stage.RENDERER, "OUTPUT_GENERATOR", "CODE_GENERATION", RiftConfig.DEFAULT_VERSION,
                null, null, null, outputFormats);
    }
}
