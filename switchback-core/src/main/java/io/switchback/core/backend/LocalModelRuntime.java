package io.switchback.core.backend;

import java.io.IOException;

/**
 * Loads local models. A runtime is asked for a model once, at backend construction.
 */
@FunctionalInterface
public interface LocalModelRuntime {
    LocalModel load(String modelRef) throws IOException;
}
