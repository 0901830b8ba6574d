package com.rift.parser;

/**
 * AST node variants.
 */
public enum AstNodeType {
    IDENTIFIER,
    NUMBER,
    BINARY_OP
}
