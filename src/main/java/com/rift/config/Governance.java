package com.rift.config;

import com.rift.coordinator.OptimizationFlags;
import com.rift.lexer.PatternRuleSet;
import com.rift.render.OutputSettings;

import java.util.Map;

/**
 * Read-only source of per-stage configuration.
 * Every lookup of a required section that is absent throws
 * {@link com.rift.exception.ConfigurationException}.
 */
public interface Governance {

    StageConfig getStageConfig(Stage stage);

    /**
     * Ordered, compiled token pattern rules. Declaration order is preserved.
     */
    PatternRuleSet getPatternRules(Stage stage);

    OptimizationFlags getOptimizationFlags(Stage stage);

    /**
     * Operator symbol to precedence level.
     */
    Map<String, Integer> getPrecedenceTable(Stage stage);

    OutputSettings getOutputSettings(Stage stage);

    /**
     * Check whether the stage's configuration has been loaded.
     */
    boolean isStageLoaded(Stage stage);

    default PatternRuleSet getPatternRules(int stageId) {
        return getPatternRules(Stage.fromId(stageId));
    }

    default OptimizationFlags getOptimizationFlags(int stageId) {
        return getOptimizationFlags(Stage.fromId(stageId));
    }
}
