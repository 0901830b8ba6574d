package com.rift.coordinator;

import com.rift.parser.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage 2: counts AST nodes and runs the enabled optimization passes in order.
 */
public class AstCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AstCoordinator.class);

    private final OptimizationPassRegistry registry;
    private final OptimizationFlags flags;

    public AstCoordinator(OptimizationPassRegistry registry, OptimizationFlags flags) {
        this.registry = registry;
        this.flags = flags;

        for (String name : flags.asMap().keySet()) {
            if (!registry.isRegistered(name)) {
                log.warn("Optimization flag '{}' has no registered pass and will be ignored", name);
            }
        }
        log.info("AstCoordinator initialized with {} enabled passes",
                registry.enabledPasses(flags).size());
    }

    public CoordinationResult coordinate(AstNode ast) {
        return coordinate(ast, flags);
    }

    /**
     * Count nodes and apply every pass enabled in the given flags.
     */
    public CoordinationResult coordinate(AstNode ast, OptimizationFlags flags) {
        int nodeCount = NodeCounter.count(ast);
        log.debug("AST contains {} nodes", nodeCount);

        AstNode current = ast;
        List<String> applied = new ArrayList<>();
        for (OptimizationPass pass : registry.enabledPasses(flags)) {
            current = pass.apply(current);
            applied.add(pass.getName());
            log.debug("Applied pass {}: {} nodes", pass.getName(), NodeCounter.count(current));
        }

        int optimizedCount = NodeCounter.count(current);
        log.debug("AST coordination complete: {} -> {} nodes, passes {}", nodeCount, optimizedCount, applied);
        return new CoordinationResult(current, nodeCount, optimizedCount, applied);
    }

    public OptimizationFlags getFlags() {
        return flags;
    }
}
