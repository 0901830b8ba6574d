package com.rift.render;

import com.rift.parser.AstNode;

/**
 * Renders an AST into text. Rendering is read-only and deterministic.
 */
public interface AstRenderer {

    OutputFormat getFormat();

    String render(AstNode ast);
}
