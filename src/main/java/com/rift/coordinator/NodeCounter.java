package com.rift.coordinator;

import com.rift.parser.AstNode;
import com.rift.parser.BinaryOpNode;

/**
 * Counts nodes in an expression tree.
 */
public final class NodeCounter {

    private NodeCounter() {
    }

    /**
     * count(null) = 0, count(n) = 1 + count(left) + count(right).
     */
    public static int count(AstNode node) {
        if (node == null) {
            return 0;
        }
        if (node instanceof BinaryOpNode binary) {
            return 1 + count(binary.left()) + count(binary.right());
        }
        return 1;
    }
}
