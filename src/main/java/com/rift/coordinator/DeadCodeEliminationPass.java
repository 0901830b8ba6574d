package com.rift.coordinator;

import com.rift.parser.AstNode;

/**
 * Placeholder for dead-code elimination. Currently the identity transform:
 * a single arithmetic expression has no unreachable parts.
 */
public class DeadCodeEliminationPass implements OptimizationPass {

    public static final String NAME = "dead_code_elimination";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public AstNode apply(AstNode root) {
        return root;
    }
}
