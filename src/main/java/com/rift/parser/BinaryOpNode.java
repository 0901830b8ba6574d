package com.rift.parser;

/**
 * Binary operation. Always has exactly two children.
 */
public record BinaryOpNode(String operator, AstNode left, AstNode right) implements AstNode {

    public BinaryOpNode {
        if (operator == null || operator.isEmpty()) {
            throw new IllegalArgumentException("Operator cannot be empty");
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Binary operation '" + operator + "' requires two operands");
        }
    }

    @Override
    public AstNodeType getType() {
        return AstNodeType.BINARY_OP;
    }
}
