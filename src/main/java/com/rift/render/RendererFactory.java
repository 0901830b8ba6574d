package com.rift.render;

/**
 * Factory for AstRenderer instances.
 */
public final class RendererFactory {

    private RendererFactory() {
    }

    public static AstRenderer create(OutputFormat format) {
        if (format == null) {
            return new LispStyleRenderer();
        }
        return switch (format) {
            case LISP_STYLE_AST -> new LispStyleRenderer();
            case C_CODE -> new InfixRenderer();
            case DOT_GRAPH -> new DotGraphRenderer();
            case JSON -> new JsonAstRenderer();
        };
    }
}
