package io.switchback.core.backend;

import java.util.Optional;

/**
 * Placeholder for a backend that could not be constructed.
 * Never available, so selection and health checks skip it.
 */
public final class DisabledBackend implements Backend {
    private final String name;
    private final BackendKind kind;
    private final String reason;

    public DisabledBackend(String name, BackendKind kind, String reason) {
        this.name = name;
        this.kind = kind;
        this.reason = reason == null || reason.isBlank() ? "backend is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BackendKind kind() {
        return kind;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    public String reason() {
        return reason;
    }

    @Override
    public Optional<String> generate(GenerationRequest request) throws BackendException {
        throw new BackendException(name, "backend " + name + " is not configured (" + reason + ")");
    }
}
