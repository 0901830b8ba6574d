package com.rift.exception;

/**
 * Exception raised when a token pattern cannot be compiled.
 * The offending rule is excluded from classification; the stage keeps running.
 */
public class PatternCompileException extends RiftException {

    private final String pattern;

    public PatternCompileException(String pattern, Throwable cause) {
        super("Malformed token pattern '" + pattern + "': " + cause.getMessage(), cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
