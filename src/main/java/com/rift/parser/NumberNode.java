package com.rift.parser;

/**
 * Numeric literal leaf. Holds the literal text as written (or as produced by folding).
 */
public record NumberNode(String text) implements AstNode {

    public NumberNode {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Number text cannot be empty");
        }
    }

    @Override
    public AstNodeType getType() {
        return AstNodeType.NUMBER;
    }
}
