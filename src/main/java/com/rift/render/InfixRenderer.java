package com.rift.render;

import com.rift.parser.AstNode;
import com.rift.parser.BinaryOpNode;
import com.rift.parser.IdentifierNode;
import com.rift.parser.NumberNode;

/**
 * C-style infix rendering with every binary operation parenthesised,
 * e.g. {@code (x + (2 * y))}.
 */
public class InfixRenderer implements AstRenderer {

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.C_CODE;
    }

    @Override
    public String render(AstNode ast) {
        if (ast instanceof IdentifierNode identifier) {
            return identifier.text();
        }
        if (ast instanceof NumberNode number) {
            return number.text();
        }
        if (ast instanceof BinaryOpNode binary) {
            return "(" + render(binary.left()) + " " + binary.operator() + " " + render(binary.right()) + ")";
        }
        throw new IllegalArgumentException("Unsupported AST node: " + ast);
    }
}
