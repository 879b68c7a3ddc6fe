package com.scaffold.backend.global.config;

/**
 * Raised while the application context starts when a setting cannot be interpreted.
 * Never mapped to an HTTP response.
 */
public class InvalidConfigurationException extends IllegalStateException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
