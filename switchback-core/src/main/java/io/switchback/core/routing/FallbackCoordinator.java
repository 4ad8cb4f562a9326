package io.switchback.core.routing;

import io.switchback.core.backend.Backend;
import io.switchback.core.backend.BackendException;
import io.switchback.core.backend.BackendRegistry;
import io.switchback.core.backend.GenerationRequest;
import io.switchback.core.fallback.FallbackIntent;
import io.switchback.core.fallback.FallbackResponses;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one request through the cascade: select, dispatch, and on failure exclude the candidate and
 * select again. When nothing is left the canned table answers. Never throws.
 */
public final class FallbackCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackCoordinator.class);

    private final BackendRegistry registry;
    private final BackendSelector selector;
    private final WindowRateLimiter rateLimiter;
    private final RoutingState state;
    private final FallbackResponses responses;

    public FallbackCoordinator(
        BackendRegistry registry,
        BackendSelector selector,
        WindowRateLimiter rateLimiter,
        RoutingState state,
        FallbackResponses responses
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.rateLimiter = rateLimiter;
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.responses = Objects.requireNonNull(responses, "responses must not be null");
    }

    public CompletionOutcome run(GenerationRequest request) {
        long started = System.nanoTime();
        Set<String> tried = new LinkedHashSet<>();
        Set<String> skipped = new HashSet<>();
        boolean throttled = false;

        while (true) {
            List<Backend> candidates = new ArrayList<>();
            for (Backend backend : registry.available()) {
                if (tried.contains(backend.name()) || skipped.contains(backend.name())) {
                    continue;
                }
                if (rateLimiter != null && !rateLimiter.check(backend.name())) {
                    throttled = true;
                    continue;
                }
                candidates.add(backend);
            }

            Optional<Backend> selected = selector.select(request.personality(), candidates, state.lastUsed());
            if (selected.isEmpty()) {
                return exhausted(request, tried, throttled, started);
            }

            Backend backend = selected.get();
            if (rateLimiter != null && !rateLimiter.tryAcquire(backend.name())) {
                LOG.debug("Backend {} reached its rate limit while being selected", backend.name());
                throttled = true;
                skipped.add(backend.name());
                continue;
            }
            tried.add(backend.name());
            LOG.debug("Selected backend {} for personality {}", backend.name(), request.personality().tag());

            long attemptStarted = System.nanoTime();
            Optional<String> text = dispatch(backend, request);
            if (text.isPresent()) {
                Duration latency = Duration.ofNanos(System.nanoTime() - attemptStarted);
                state.recordSuccess(backend.name(), latency);
                LOG.info("Backend {} served request in {} ms", backend.name(), latency.toMillis());
                return CompletionOutcome.served(text.get(), backend.name(), elapsed(started), List.copyOf(tried));
            }
            if (rateLimiter != null) {
                rateLimiter.release(backend.name());
            }
        }
    }

    private Optional<String> dispatch(Backend backend, GenerationRequest request) {
        try {
            Optional<String> text = backend.generate(request);
            if (text == null || text.isEmpty() || text.get().isBlank()) {
                LOG.warn("Backend {} returned an empty response", backend.name());
                return Optional.empty();
            }
            return text;
        } catch (BackendException e) {
            LOG.warn("Backend {} failed: {}", e.backend(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Backend {} failed unexpectedly: {}", backend.name(), e.toString());
        }
        return Optional.empty();
    }

    private CompletionOutcome exhausted(GenerationRequest request, Set<String> tried, boolean throttled, long started) {
        FallbackIntent.Exhaustion exhaustion;
        if (!tried.isEmpty()) {
            exhaustion = FallbackIntent.Exhaustion.ALL_FAILED;
        } else if (throttled) {
            exhaustion = FallbackIntent.Exhaustion.RATE_LIMITED;
        } else {
            exhaustion = FallbackIntent.Exhaustion.NO_BACKEND;
        }
        String key = FallbackIntent.keyFor(request.message(), exhaustion);
        if (tried.isEmpty()) {
            LOG.error("No backend available ({}), answering with fallback '{}'", exhaustion, key);
        } else {
            LOG.error("All backends failed {}, answering with fallback '{}'", tried, key);
        }
        return CompletionOutcome.fallback(responses.lookup(key), key, elapsed(started), List.copyOf(tried));
    }

    private Duration elapsed(long started) {
        return Duration.ofNanos(System.nanoTime() - started);
    }
}
