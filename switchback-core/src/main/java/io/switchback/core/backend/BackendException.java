package io.switchback.core.backend;

/**
 * A single failed call to a backend. Always recoverable by moving on to the next candidate.
 */
public class BackendException extends Exception {
    private final String backend;

    public BackendException(String backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public String backend() {
        return backend;
    }
}
