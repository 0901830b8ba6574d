package com.rift.exception;

/**
 * Exception thrown when governance configuration is missing or invalid.
 * Fatal to the stage being constructed.
 */
public class ConfigurationException extends RiftException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
