package org.carma.hedonic.model;

/**
 * Raised when a scenario is malformed or internally inconsistent.
 * The search never runs on a configuration that failed to build.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
