package com.rift.coordinator;

import com.rift.parser.AstNode;

/**
 * Placeholder for common-subexpression elimination. Currently the identity transform.
 */
public class CommonSubexpressionEliminationPass implements OptimizationPass {

    public static final String NAME = "common_subexpression_elimination";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public AstNode apply(AstNode root) {
        return root;
    }
}
