package io.switchback.core.backend;

/**
 * Thrown while constructing a backend whose credential or model is missing or cannot be loaded.
 */
public class BackendConfigurationException extends Exception {

    public BackendConfigurationException(String message) {
        super(message);
    }

    public BackendConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
