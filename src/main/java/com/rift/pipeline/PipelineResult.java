package com.rift.pipeline;

import java.util.Optional;

/**
 * Result of a pipeline run: either rendered output or a typed error.
 */
public interface PipelineResult {

    boolean isSuccess();

    /**
     * Rendered output, present only on success.
     */
    Optional<RenderedOutput> getOutput();

    /**
     * Error, present only on failure.
     */
    Optional<PipelineError> getError();
}
