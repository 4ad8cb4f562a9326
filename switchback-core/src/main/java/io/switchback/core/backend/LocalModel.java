package io.switchback.core.backend;

import java.io.IOException;

/**
 * Handle to a loaded local model.
 */
public interface LocalModel extends AutoCloseable {
    String generate(String prompt, int maxTokens, double temperature) throws IOException;

    @Override
    default void close() {
    }
}
