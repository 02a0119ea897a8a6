package com.driftsentinel.core.config;

/**
 * Fatal configuration problem detected before any data is processed.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
