package com.rift.exception;

/**
 * Exception thrown when a pipeline structure cannot grow any further: the token
 * stream is at its maximum capacity or the expression tree is too deep.
 */
public class AllocationException extends RiftException {

    public AllocationException(String message) {
        super(message);
    }
}
