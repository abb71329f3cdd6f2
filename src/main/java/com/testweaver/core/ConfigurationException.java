package com.testweaver.core;

/**
 * Raised when a config file cannot be read or a setting has an invalid value.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
