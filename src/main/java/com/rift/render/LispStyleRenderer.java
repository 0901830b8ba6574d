package com.rift.render;

import com.rift.parser.AstNode;
import com.rift.parser.BinaryOpNode;
import com.rift.parser.IdentifierNode;
import com.rift.parser.NumberNode;

/**
 * Canonical prefix rendering. Each node is one line; binary operation children
 * are indented one level and the closing parenthesis sits at the parent's indent:
 * <pre>
 * (BinOp +
 *   (Identifier x)
 *   (Number 2)
 * )
 * </pre>
 */
public class LispStyleRenderer implements AstRenderer {

    private static final String INDENT = "  ";

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.LISP_STYLE_AST;
    }

    @Override
    public String render(AstNode ast) {
        StringBuilder out = new StringBuilder();
        render(ast, 0, out);
        return out.toString();
    }

    private void render(AstNode node, int depth, StringBuilder out) {
        indent(depth, out);
        if (node instanceof IdentifierNode identifier) {
            out.append("(Identifier ").append(identifier.text()).append(")\n");
        } else if (node instanceof NumberNode number) {
            out.append("(Number ").append(number.text()).append(")\n");
        } else if (node instanceof BinaryOpNode binary) {
            out.append("(BinOp ").append(binary.operator()).append('\n');
            render(binary.left(), depth + 1, out);
            render(binary.right(), depth + 1, out);
            indent(depth, out);
            out.append(")\n");
        } else {
            throw new IllegalArgumentException("Unsupported AST node: " + node);
        }
    }

    private static void indent(int depth, StringBuilder out) {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
    }
}
