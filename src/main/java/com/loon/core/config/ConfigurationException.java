package com.loon.core.config;

/**
 * Thrown when the harness is set up incorrectly: unbalanced suites, an invalid
 * run option, a plugin without a name or a test unit that cannot be loaded.
 * Always fatal for the run in progress.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
