package com.bsl.dimrank.config;

/**
 * Raised when the retrieval configuration cannot be loaded or fails validation.
 * A configuration that raises this is never installed, not even partially.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
