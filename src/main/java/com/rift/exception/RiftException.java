package com.rift.exception;

/**
 * Base exception for the RIFT pipeline.
 */
public class RiftException extends RuntimeException {

    public RiftException(String message) {
        super(message);
    }

    public RiftException(String message, Throwable cause) {
        super(message, cause);
    }
}
