package com.rift.render;

import com.rift.parser.AstNode;
import com.rift.parser.BinaryOpNode;
import com.rift.parser.IdentifierNode;
import com.rift.parser.NumberNode;

/**
 * Graphviz rendering. Node ids are assigned in pre-order starting at 0.
 */
public class DotGraphRenderer implements AstRenderer {

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.DOT_GRAPH;
    }

    @Override
    public String render(AstNode ast) {
        StringBuilder out = new StringBuilder("digraph AST {\n");
        visit(ast, new int[]{0}, out);
        out.append("}\n");
        return out.toString();
    }

    private int visit(AstNode node, int[] nextId, StringBuilder out) {
        int id = nextId[0]++;
        out.append("  n").append(id).append(" [label=\"").append(label(node)).append("\"];\n");
        if (node instanceof BinaryOpNode binary) {
            int left = visit(binary.left(), nextId, out);
            int right = visit(binary.right(), nextId, out);
            out.append("  n").append(id).append(" -> n").append(left).append(";\n");
            out.append("  n").append(id).append(" -> n").append(right).append(";\n");
        }
        return id;
    }

    private static String label(AstNode node) {
        if (node instanceof IdentifierNode identifier) {
            return "Identifier " + escape(identifier.text());
        }
        if (node instanceof NumberNode number) {
            return "Number " + escape(number.text());
        }
        if (node instanceof BinaryOpNode binary) {
            return "BinOp " + escape(binary.operator());
        }
        throw new IllegalArgumentException("Unsupported AST node: " + node);
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
