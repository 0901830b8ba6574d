package com.rift.config;

import com.rift.exception.ConfigurationException;

/**
 * Pipeline stages in execution order.
 */
public enum Stage {
    TOKENIZER(0, "tokenizer"),
    PARSER(1, "parser"),
    COORDINATOR(2, "coordinator"),
    RENDERER(3, "renderer");

    private final int id;
    private final String key;

    Stage(int id, String key) {
        this.id = id;
        this.key = key;
    }

    public int getId() {
        return id;
    }

    /**
     * Key of the stage section in the governance YAML.
     */
    public String getKey() {
        return key;
    }

    public static Stage fromId(int id) {
        for (Stage stage : values()) {
            if (stage.id == id) {
                return stage;
            }
        }
        throw new ConfigurationException("Unknown stage id " + id + ", expected 0-3");
    }

    /**
     * Resolve a stage from its key, enum name or numeric id.
     */
    public static Stage fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new ConfigurationException("Stage key cannot be empty");
        }
        String normalized = key.trim();
        for (Stage stage : values()) {
            if (stage.key.equalsIgnoreCase(normalized) || stage.name().equalsIgnoreCase(normalized)) {
                return stage;
            }
        }
        try {
            return fromId(Integer.parseInt(normalized));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Unknown stage: " + key, e);
        }
    }
}
