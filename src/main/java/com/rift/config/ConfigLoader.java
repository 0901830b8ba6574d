package com.rift.config;

import com.rift.exception.ConfigurationException;
import com.rift.lexer.TokenCategory;
import com.rift.render.OutputFormat;
import com.rift.render.OutputSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads RIFT governance configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static RiftConfig load(String path) {
        log.info("Loading RIFT governance from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return load(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from a YAML stream. The stream is not closed.
     */
    public static RiftConfig load(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(inputStream);

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMap(document, "<root>");

        // The rift section may be at root or under a 'rift' key
        Map<String, Object> riftConfig = root.containsKey("rift")
                ? asMap(root.get("rift"), "rift")
                : root;

        String name = getString(riftConfig, "name", "rift");
        String version = getString(riftConfig, "version", RiftConfig.DEFAULT_VERSION);

        Map<Stage, StageConfig> stages = new EnumMap<>(Stage.class);
        Map<Object, Object> stagesMap = asMap(riftConfig.get("stages"), "stages");
        if (stagesMap.isEmpty()) {
            log.warn("No stages configured in '{}'", name);
        } else {
            for (Map.Entry<Object, Object> entry : stagesMap.entrySet()) {
                Stage stage = Stage.fromKey(String.valueOf(entry.getKey()));
                if (stages.containsKey(stage)) {
                    throw new ConfigurationException("Stage " + stage.getKey() + " is configured more than once");
                }
                stages.put(stage, parseStage(stage, asMap(entry.getValue(), "stages." + stage.getKey())));
            }
        }

        RiftConfig config = new RiftConfig(name, version, stages);
        log.info("Loaded RIFT governance: {} v{} with stages {}", name, version, stages.keySet());
        return config;
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Type-checked view of a YAML mapping. A missing section yields an empty map.
     */
    @SuppressWarnings("unchecked")
    private static <K> Map<K, Object> asMap(Object value, String section) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("Section '" + section + "' must be a mapping, got: " + value);
        }
        return (Map<K, Object>) value;
    }

    private static List<?> asList(Object value, String section) {
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("Section '" + section + "' must be a list, got: " + value);
        }
        return list;
    }

    private static StageConfig parseStage(Stage stage, Map<String, Object> map) {
        String stageName = getString(map, "stage-name", stage.name());
        String spAlignment = getString(map, "sp-alignment", null);
        String governanceVersion = getString(map, "governance-version", RiftConfig.DEFAULT_VERSION);

        List<PatternRuleConfig> tokenPatterns = parseTokenPatterns(map.get("token-patterns"), stage);
        Map<String, Integer> precedenceTable = parsePrecedenceTable(map.get("precedence-table"), stage);
        Map<String, Boolean> optimizationPasses = parseOptimizationPasses(map.get("optimization-passes"), stage);
        OutputSettings outputFormats = parseOutputFormats(map.get("output-formats"), stage);

        log.debug("Parsed stage {}: name={}, alignment={}, version={}",
                stage.getId(), stageName, spAlignment, governanceVersion);

        return new StageConfig(stage, stageName, spAlignment, governanceVersion,
                tokenPatterns, precedenceTable, optimizationPasses, outputFormats);
    }

    private static List<PatternRuleConfig> parseTokenPatterns(Object section, Stage stage) {
        if (section == null) {
            return null;
        }
        List<?> list = asList(section, stage.getKey() + ".token-patterns");
        List<PatternRuleConfig> rules = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> ruleMap = asMap(list.get(i), stage.getKey() + ".token-patterns[" + i + "]");
            String categoryStr = requireString(ruleMap, "category", stage, "token-patterns[" + i + "]");
            TokenCategory category;
            try {
                category = TokenCategory.valueOf(categoryStr.toUpperCase().replace("-", "_"));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown token category '" + categoryStr
                        + "' in token-patterns[" + i + "]", e);
            }
            if (category == TokenCategory.UNKNOWN) {
                throw new ConfigurationException("Category UNKNOWN is reserved and cannot be assigned by a rule");
            }
            String pattern = requireString(ruleMap, "pattern", stage, "token-patterns[" + i + "]");
            if (!ruleMap.containsKey("priority")) {
                throw new ConfigurationException("Missing 'priority' in token-patterns[" + i + "] of stage "
                        + stage.getKey());
            }
            int priority = getInt(ruleMap, "priority", 0);
            rules.add(new PatternRuleConfig(category, pattern, priority));
            log.debug("Parsed token pattern: category={}, pattern={}, priority={}", category, pattern, priority);
        }
        return rules;
    }

    private static Map<String, Integer> parsePrecedenceTable(Object section, Stage stage) {
        if (section == null) {
            return null;
        }
        Map<Object, Object> map = asMap(section, stage.getKey() + ".precedence-table");
        Map<String, Integer> table = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : map.entrySet()) {
            Object level = entry.getValue();
            if (level == null) {
                throw new ConfigurationException("Missing precedence level for operator '" + entry.getKey()
                        + "' in stage " + stage.getKey());
            }
            table.put(String.valueOf(entry.getKey()), toInt(level));
        }
        return table;
    }

    private static Map<String, Boolean> parseOptimizationPasses(Object section, Stage stage) {
        if (section == null) {
            return null;
        }
        Map<Object, Object> map = asMap(section, stage.getKey() + ".optimization-passes");
        Map<String, Boolean> passes = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            passes.put(name, parseEnablement(entry.getValue(), name, stage));
        }
        return passes;
    }

    private static OutputSettings parseOutputFormats(Object section, Stage stage) {
        if (section == null) {
            return null;
        }
        Map<String, Object> map = asMap(section, stage.getKey() + ".output-formats");
        String primary = getString(map, "primary-format", OutputFormat.LISP_STYLE_AST.name());
        String secondary = getString(map, "secondary-format", null);
        String debug = getString(map, "debug-format", null);
        Object jsonExport = map.get("json-export");

        return new OutputSettings(
                OutputFormat.fromName(primary),
                secondary != null ? OutputFormat.fromName(secondary) : null,
                debug != null ? OutputFormat.fromName(debug) : null,
                jsonExport != null && parseEnablement(jsonExport, "json-export", stage)
        );
    }

    private static boolean parseEnablement(Object value, String key, Stage stage) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(value).trim().toLowerCase();
        return switch (text) {
            case "enabled", "true", "on", "yes" -> true;
            case "disabled", "false", "off", "no" -> false;
            default -> throw new ConfigurationException("Invalid value '" + value + "' for '" + key
                    + "' in stage " + stage.getKey() + ", expected enabled/disabled");
        };
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static String requireString(Map<String, Object> map, String key, Stage stage, String location) {
        Object value = map.get(key);
        if (value == null) {
            throw new ConfigurationException("Missing '" + key + "' in " + location + " of stage " + stage.getKey());
        }
        return value.toString();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        return toInt(value);
    }

    private static int toInt(Object value) {
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer, got: " + value, e);
        }
    }
}
