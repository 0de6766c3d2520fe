package com.finchat.rag.exception;

/**
 * Raised when static configuration (rule table, templates, chunking settings) is malformed.
 * Only thrown during startup; query handling never raises it.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
