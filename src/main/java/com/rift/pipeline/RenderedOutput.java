package com.rift.pipeline;

import com.rift.render.OutputFormat;

import java.util.List;
import java.util.Map;

/**
 * Successful pipeline output.
 *
 * @param text               Rendering in the primary format
 * @param format             Primary format
 * @param additionalOutputs  Renderings in the secondary, debug and export formats
 * @param tokenCount         Number of tokens produced by the tokenizer
 * @param nodeCount          AST node count before optimization
 * @param optimizedNodeCount AST node count after optimization
 * @param appliedPasses      Optimization passes that ran, in order
 */
public record RenderedOutput(
        String text,
        OutputFormat format,
        Map<OutputFormat, String> additionalOutputs,
        int tokenCount,
        int nodeCount,
        int optimizedNodeCount,
        List<String> appliedPasses
) {
    public RenderedOutput {
        additionalOutputs = Map.copyOf(additionalOutputs);
        appliedPasses = List.copyOf(appliedPasses);
    }
}
