package io.switchback.core.backend;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend over a model loaded once through a {@link LocalModelRuntime}. Calls are serialized on a
 * single worker and abandoned once the timeout elapses.
 */
public final class LocalModelBackend implements Backend, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LocalModelBackend.class);

    private static final PersonalityPrompts PROMPTS = PersonalityPrompts.of(Map.of(
        Personality.HELPFUL, "You are a helpful AI assistant. ",
        Personality.CREATIVE, "You are a creative AI assistant. ",
        Personality.ANALYTICAL, "You are an analytical AI assistant. ",
        Personality.FUNNY, "You are a funny AI assistant. "
    ));

    private final String name;
    private final String modelRef;
    private final LocalModel model;
    private final Duration timeout;
    private final ExecutorService worker;

    public LocalModelBackend(String name, LocalModelRuntime runtime, String modelRef, Duration timeout)
        throws BackendConfigurationException {
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(runtime, "runtime must not be null");
        if (modelRef == null || modelRef.isBlank()) {
            throw new BackendConfigurationException("missing model path for backend " + name);
        }
        this.modelRef = modelRef;
        try {
            this.model = Objects.requireNonNull(runtime.load(modelRef), "runtime returned no model");
        } catch (IOException | RuntimeException e) {
            throw new BackendConfigurationException("failed to load local model " + modelRef + ": " + e.getMessage(), e);
        }
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(60) : timeout;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "local-model-" + name);
            thread.setDaemon(true);
            return thread;
        });
        LOG.info("Local model {} loaded for backend {}", modelRef, name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.LOCAL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<String> generate(GenerationRequest request) throws BackendException {
        Objects.requireNonNull(request, "request must not be null");
        String prompt = PROMPTS.promptFor(request.personality()) + request.message();
        Future<String> pending;
        try {
            pending = worker.submit(() -> model.generate(prompt, request.maxTokens(), request.temperature()));
        } catch (RuntimeException e) {
            throw new BackendException(name, "local model worker rejected the call: " + e.getMessage(), e);
        }

        try {
            String text = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(text.trim());
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new BackendException(name, "local generation timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new BackendException(name, "local generation failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new BackendException(name, "interrupted while waiting for local generation", e);
        }
    }

    @Override
    public void close() {
        worker.shutdownNow();
        try {
            model.close();
        } catch (Exception e) {
            LOG.warn("Failed to close local model {}: {}", modelRef, e.getMessage());
        }
    }
}
