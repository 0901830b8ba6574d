package com.rift.coordinator;

import com.rift.parser.AstNode;

import java.util.List;

/**
 * Output of the coordinator stage.
 *
 * @param ast                Tree after all enabled passes
 * @param nodeCount          Node count of the tree as received from the parser
 * @param optimizedNodeCount Node count of the returned tree
 * @param appliedPasses      Names of the passes that ran, in order
 */
public record CoordinationResult(AstNode ast, int nodeCount, int optimizedNodeCount, List<String> appliedPasses) {

    public CoordinationResult {
        appliedPasses = List.copyOf(appliedPasses);
    }
}
