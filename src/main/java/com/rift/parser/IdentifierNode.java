package com.rift.parser;

/**
 * Identifier leaf.
 */
public record IdentifierNode(String text) implements AstNode {

    public IdentifierNode {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Identifier text cannot be empty");
        }
    }

    @Override
    public AstNodeType getType() {
        return AstNodeType.IDENTIFIER;
    }
}
