package com.rift.coordinator;

import com.rift.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered registry of optimization passes. Passes run in registration order.
 */
public class OptimizationPassRegistry {

    private static final Logger log = LoggerFactory.getLogger(OptimizationPassRegistry.class);

    private final Map<String, OptimizationPass> passes = new LinkedHashMap<>();

    /**
     * Registry with the built-in passes: constant folding, dead-code elimination,
     * common-subexpression elimination.
     */
    public static OptimizationPassRegistry defaults() {
        OptimizationPassRegistry registry = new OptimizationPassRegistry();
        registry.register(new ConstantFoldingPass());
        registry.register(new DeadCodeEliminationPass());
        registry.register(new CommonSubexpressionEliminationPass());
        return registry;
    }

    /**
     * Register a pass.
     *
     * @throws ConfigurationException if a pass with the same name is already registered
     */
    public OptimizationPassRegistry register(OptimizationPass pass) {
        if (pass == null || pass.getName() == null || pass.getName().isBlank()) {
            throw new IllegalArgumentException("Pass and pass name cannot be null");
        }
        if (passes.containsKey(pass.getName())) {
            throw new ConfigurationException("Optimization pass already registered: " + pass.getName());
        }
        passes.put(pass.getName(), pass);
        log.debug("Registered optimization pass: {}", pass.getName());
        return this;
    }

    public Optional<OptimizationPass> get(String name) {
        return Optional.ofNullable(passes.get(name));
    }

    public boolean isRegistered(String name) {
        return passes.containsKey(name);
    }

    public List<OptimizationPass> getPasses() {
        return new ArrayList<>(passes.values());
    }

    /**
     * Passes enabled by the given flags, in registration order.
     */
    public List<OptimizationPass> enabledPasses(OptimizationFlags flags) {
        List<OptimizationPass> enabled = new ArrayList<>();
        for (OptimizationPass pass : passes.values()) {
            if (flags.isEnabled(pass.getName())) {
                enabled.add(pass);
            }
        }
        return enabled;
    }
}
