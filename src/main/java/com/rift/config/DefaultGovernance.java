package com.rift.config;

import com.rift.coordinator.OptimizationFlags;
import com.rift.exception.ConfigurationException;
import com.rift.lexer.PatternRuleSet;
import com.rift.render.OutputSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Governance backed by a {@link RiftConfig}.
 * Stage sections are loaded on first access and cached for the lifetime of this
 * instance; compiled rule sets are cached per stage. Not thread-safe.
 */
public class DefaultGovernance implements Governance {

    private static final Logger log = LoggerFactory.getLogger(DefaultGovernance.class);

    private final RiftConfig config;
    private final Map<Stage, StageConfig> loaded = new EnumMap<>(Stage.class);
    private final Map<Stage, PatternRuleSet> ruleSets = new EnumMap<>(Stage.class);

    public DefaultGovernance(RiftConfig config) {
        if (config == null) {
            throw new ConfigurationException("Governance configuration cannot be null");
        }
        this.config = config;
        log.info("Governance initialized: {} v{} with {} stage sections",
                config.name(), config.version(), config.stages().size());
    }

    @Override
    public StageConfig getStageConfig(Stage stage) {
        StageConfig cached = loaded.get(stage);
        if (cached != null) {
            return cached;
        }
        StageConfig stageConfig = config.getStage(stage)
                .orElseThrow(() -> new ConfigurationException(
                        "No configuration for stage " + stage.getId() + " (" + stage.getKey() + ")"));
        loaded.put(stage, stageConfig);
        log.info("Loaded stage {} ({}) with SP alignment: {}",
                stage.getId(), stageConfig.stageName(), stageConfig.spAlignment());
        return stageConfig;
    }

    @Override
    public PatternRuleSet getPatternRules(Stage stage) {
        PatternRuleSet cached = ruleSets.get(stage);
        if (cached != null) {
            return cached;
        }
        List<PatternRuleConfig> patterns = require(stage, getStageConfig(stage).tokenPatterns(), "token-patterns");

        PatternRuleSet.Builder builder = PatternRuleSet.builder();
        for (PatternRuleConfig rule : patterns) {
            builder.rule(rule.category(), rule.pattern(), rule.priority());
        }
        PatternRuleSet ruleSet = builder.build();
        ruleSets.put(stage, ruleSet);
        log.debug("Compiled {} pattern rules for stage {}", ruleSet.size(), stage);
        return ruleSet;
    }

    @Override
    public OptimizationFlags getOptimizationFlags(Stage stage) {
        Map<String, Boolean> passes = require(stage, getStageConfig(stage).optimizationPasses(),
                "optimization-passes");
        return new OptimizationFlags(passes);
    }

    @Override
    public Map<String, Integer> getPrecedenceTable(Stage stage) {
        return Map.copyOf(require(stage, getStageConfig(stage).precedenceTable(), "precedence-table"));
    }

    @Override
    public OutputSettings getOutputSettings(Stage stage) {
        return require(stage, getStageConfig(stage).outputFormats(), "output-formats");
    }

    @Override
    public boolean isStageLoaded(Stage stage) {
        return loaded.containsKey(stage);
    }

    public RiftConfig getConfig() {
        return config;
    }

    private static <T> T require(Stage stage, T section, String sectionName) {
        if (section == null) {
            throw new ConfigurationException("Stage " + stage.getId() + " (" + stage.getKey()
                    + ") has no '" + sectionName + "' section");
        }
        return section;
    }
}
