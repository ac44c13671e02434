package com.sailfish.pool.exception;

/**
 * Thrown when a scheduler is configured with invalid bounds or unparsable settings.
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
