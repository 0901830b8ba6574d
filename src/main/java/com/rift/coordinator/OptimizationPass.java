package com.rift.coordinator;

import com.rift.parser.AstNode;

/**
 * A named, pure tree-to-tree transformation.
 * Implementations must not modify the input tree; they return the rewritten
 * tree, or the same instance when nothing changes.
 */
public interface OptimizationPass {

    /**
     * Name used to look up the pass enablement flag.
     */
    String getName();

    AstNode apply(AstNode root);
}
