package com.rift.render;

import com.rift.exception.ConfigurationException;

/**
 * Output formats supported by the renderer stage.
 */
public enum OutputFormat {
    /**
     * Canonical indented S-expression form.
     */
    LISP_STYLE_AST,

    /**
     * Fully parenthesised C-style infix expression.
     */
    C_CODE,

    /**
     * Graphviz digraph of the tree.
     */
    DOT_GRAPH,

    /**
     * JSON tree export.
     */
    JSON;

    /**
     * Parse a format name, accepting dashes and any case.
     *
     * @throws ConfigurationException for unknown names
     */
    public static OutputFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Output format name cannot be empty");
        }
        try {
            return OutputFormat.valueOf(name.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown output format: " + name, e);
        }
    }
}
