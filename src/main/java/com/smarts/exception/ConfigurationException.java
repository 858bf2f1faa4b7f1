package com.smarts.exception;

/**
 * Exception thrown when parser settings or a pattern library are invalid.
 * Results in fail-fast at load time.
 */
public class ConfigurationException extends SmartsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
