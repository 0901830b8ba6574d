package com.rift.parser;

/**
 * Node of the expression tree.
 * Trees are immutable; children are owned by exactly one parent.
 */
public interface AstNode {

    AstNodeType getType();

    default boolean isLeaf() {
        return getType() != AstNodeType.BINARY_OP;
    }
}
