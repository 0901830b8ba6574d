package com.rift.exception;

/**
 * Exception thrown when an AST cannot be rendered in the requested format.
 */
public class RenderException extends RiftException {

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
