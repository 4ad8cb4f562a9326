package io.switchback.core.orchestrator;

import io.switchback.core.backend.BackendRegistry;
import io.switchback.core.backend.GenerationRequest;
import io.switchback.core.config.model.RoutingConfig;
import io.switchback.core.fallback.FallbackResponses;
import io.switchback.core.routing.BackendSelector;
import io.switchback.core.routing.CompletionOutcome;
import io.switchback.core.routing.FallbackCoordinator;
import io.switchback.core.routing.RoutingState;
import io.switchback.core.routing.WindowRateLimiter;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point for completions. Every call resolves to text: a backend reply when one
 * succeeds, otherwise an entry of the fallback table.
 */
public final class CompletionOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CompletionOrchestrator.class);

    private final BackendRegistry registry;
    private final FallbackResponses responses;
    private final RoutingState state;
    private final WindowRateLimiter rateLimiter;
    private final FallbackCoordinator coordinator;
    private final ExecutorService executor;

    public CompletionOrchestrator(
        BackendRegistry registry,
        BackendSelector selector,
        WindowRateLimiter rateLimiter,
        FallbackResponses responses
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.responses = Objects.requireNonNull(responses, "responses must not be null");
        this.rateLimiter = rateLimiter;
        this.state = new RoutingState();
        this.coordinator = new FallbackCoordinator(registry, selector, rateLimiter, state, responses);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "completion-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Builds an orchestrator from routing settings. A non-empty {@code rateLimits} map turns on the
     * rate-limited selection.
     */
    public static CompletionOrchestrator create(
        RoutingConfig routing,
        BackendRegistry registry,
        FallbackResponses responses,
        Clock clock
    ) {
        Objects.requireNonNull(routing, "routing must not be null");
        List<String> priority = routing.priority().isEmpty() ? BackendSelector.DEFAULT_PRIORITY : routing.priority();
        WindowRateLimiter limiter = null;
        if (routing.rateLimited()) {
            Duration window = routing.rateWindowSeconds() > 0
                ? Duration.ofSeconds(routing.rateWindowSeconds())
                : WindowRateLimiter.DEFAULT_WINDOW;
            limiter = new WindowRateLimiter(routing.rateLimits(), window, clock);
            LOG.info("Rate limits enabled: {} per {} s", routing.rateLimits(), window.toSeconds());
        }
        return new CompletionOrchestrator(registry, new BackendSelector(priority), limiter, responses);
    }

    public String generateResponse(String message) {
        return generateResponse(GenerationRequest.of(message));
    }

    public String generateResponse(String message, String personality, int maxTokens, double temperature) {
        return generateResponse(GenerationRequest.of(message, personality, maxTokens, temperature));
    }

    public String generateResponse(GenerationRequest request) {
        return complete(request).text();
    }

    public CompletableFuture<String> generateResponseAsync(String message) {
        return generateResponseAsync(GenerationRequest.of(message));
    }

    public CompletableFuture<String> generateResponseAsync(
        String message,
        String personality,
        int maxTokens,
        double temperature
    ) {
        return generateResponseAsync(GenerationRequest.of(message, personality, maxTokens, temperature));
    }

    /**
     * Runs the cascade on the orchestrator's executor. After {@link #close()} the executor rejects
     * new work, so the request is answered on the calling thread and returned as a completed future.
     */
    public CompletableFuture<String> generateResponseAsync(GenerationRequest request) {
        try {
            return CompletableFuture.supplyAsync(() -> generateResponse(request), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Async executor rejected the request, answering on the calling thread: {}", e.getMessage());
            return CompletableFuture.completedFuture(generateResponse(request));
        }
    }

    public CompletionOutcome complete(GenerationRequest request) {
        GenerationRequest safe = request == null ? GenerationRequest.of("") : request;
        try {
            return coordinator.run(safe);
        } catch (RuntimeException e) {
            LOG.error("Completion failed outside of backend dispatch", e);
            return CompletionOutcome.fallback(
                responses.lookup(FallbackResponses.ERROR),
                FallbackResponses.ERROR,
                Duration.ZERO,
                List.of()
            );
        }
    }

    public String lastUsed() {
        return state.lastUsed();
    }

    public Map<String, Duration> latencies() {
        return state.latencies();
    }

    public WindowRateLimiter rateLimiter() {
        return rateLimiter;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        registry.all().forEach(backend -> {
            if (backend instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    LOG.warn("Failed to close backend {}: {}", backend.name(), e.getMessage());
                }
            }
        });
    }
}
