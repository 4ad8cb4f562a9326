package io.switchback.core.backend;

import java.util.Optional;

/**
 * A single completion provider, local or hosted.
 *
 * <p>Implementations are constructed once at startup. A backend whose construction failed is
 * represented by {@link DisabledBackend} and stays unavailable for the life of the process.
 */
public interface Backend {
    String name();

    BackendKind kind();

    boolean isAvailable();

    /**
     * Runs one blocking completion.
     *
     * @return the trimmed completion text, or empty when the provider answered with nothing
     * @throws BackendException on network failure, timeout, non-2xx status or malformed payload
     */
    Optional<String> generate(GenerationRequest request) throws BackendException;
}
