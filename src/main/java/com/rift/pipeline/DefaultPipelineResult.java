package com.rift.pipeline;

import java.util.Optional;

/**
 * Default implementation of PipelineResult.
 */
public class DefaultPipelineResult implements PipelineResult {

    private final RenderedOutput output;
    private final PipelineError error;

    private DefaultPipelineResult(RenderedOutput output, PipelineError error) {
        this.output = output;
        this.error = error;
    }

    @Override
    public boolean isSuccess() {
        return output != null;
    }

    @Override
    public Optional<RenderedOutput> getOutput() {
        return Optional.ofNullable(output);
    }

    @Override
    public Optional<PipelineError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "PipelineResult{success, tokens=" + output.tokenCount()
                    + ", nodes=" + output.nodeCount() + "->" + output.optimizedNodeCount() + '}';
        }
        return "PipelineResult{failure, kind=" + error.kind() + ", message=" + error.message() + '}';
    }

    public static PipelineResult success(RenderedOutput output) {
        return new DefaultPipelineResult(output, null);
    }

    public static PipelineResult failure(PipelineError error) {
        return new DefaultPipelineResult(null, error);
    }
}
