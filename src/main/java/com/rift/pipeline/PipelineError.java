package com.rift.pipeline;

import com.rift.exception.AllocationException;
import com.rift.exception.ConfigurationException;
import com.rift.exception.ParseException;
import com.rift.exception.PatternCompileException;
import com.rift.exception.RiftException;

/**
 * Typed failure of a pipeline run.
 *
 * @param kind     Error kind
 * @param stageName Stage that failed, or null when the failure happened before any stage ran
 * @param message  Diagnostic message
 * @param position 1-based token position for parse errors, -1 otherwise
 */
public record PipelineError(ErrorKind kind, String stageName, String message, int position) {

    public static final int NO_POSITION = -1;

    public enum ErrorKind {
        CONFIG_MISSING,
        PATTERN_COMPILE,
        UNEXPECTED_TOKEN,
        UNEXPECTED_END,
        ALLOCATION_FAILURE,
        RENDER_FAILURE
    }

    /**
     * Map a pipeline exception to its error value.
     */
    public static PipelineError from(RiftException exception, String stageName) {
        if (exception instanceof ParseException parse) {
            ErrorKind kind = parse.getKind() == ParseException.Kind.UNEXPECTED_END
                    ? ErrorKind.UNEXPECTED_END
                    : ErrorKind.UNEXPECTED_TOKEN;
            return new PipelineError(kind, stageName, parse.getMessage(), parse.getPosition());
        }
        ErrorKind kind;
        if (exception instanceof ConfigurationException) {
            kind = ErrorKind.CONFIG_MISSING;
        } else if (exception instanceof PatternCompileException) {
            kind = ErrorKind.PATTERN_COMPILE;
        } else if (exception instanceof AllocationException) {
            kind = ErrorKind.ALLOCATION_FAILURE;
        } else {
            kind = ErrorKind.RENDER_FAILURE;
        }
        return new PipelineError(kind, stageName, exception.getMessage(), NO_POSITION);
    }

    public boolean hasPosition() {
        return position != NO_POSITION;
    }
}
