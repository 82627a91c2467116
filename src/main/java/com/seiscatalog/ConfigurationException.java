package com.seiscatalog;

/**
 * Raised when a template, field definition or filter criterion cannot be used.
 * Always thrown at configuration time, before any file is scanned.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
