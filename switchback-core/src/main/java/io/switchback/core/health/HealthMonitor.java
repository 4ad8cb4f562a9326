package io.switchback.core.health;

import io.switchback.core.backend.Backend;
import io.switchback.core.backend.BackendRegistry;
import io.switchback.core.backend.GenerationRequest;
import io.switchback.core.backend.Personality;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes every registered backend in parallel with a tiny request and aggregates the results.
 * Independent of request traffic: probes do not touch routing state or rate limits.
 */
public final class HealthMonitor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);
    static final GenerationRequest PROBE = new GenerationRequest("Hello", Personality.HELPFUL, 10, 0.0);

    private final BackendRegistry registry;
    private final Duration probeTimeout;
    private final Duration degradedThreshold;
    private final Clock clock;
    private final Instant startedAt;
    private final ExecutorService executor;

    public HealthMonitor(BackendRegistry registry, Duration probeTimeout, Duration degradedThreshold, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        this.degradedThreshold = Objects.requireNonNull(degradedThreshold, "degradedThreshold must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "health-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public HealthReport check() {
        List<CompletableFuture<ServiceHealth>> probes = new ArrayList<>();
        for (Backend backend : registry.all()) {
            probes.add(probe(backend));
        }
        List<ServiceHealth> services = new ArrayList<>();
        for (CompletableFuture<ServiceHealth> probe : probes) {
            services.add(probe.join());
        }
        Instant now = clock.instant();
        HealthReport report = HealthReport.aggregate(now, services, Duration.between(startedAt, now));
        LOG.info("Health check finished: {}", report.status().label());
        return report;
    }

    private CompletableFuture<ServiceHealth> probe(Backend backend) {
        Instant checkedAt = clock.instant();
        if (!backend.isAvailable()) {
            return CompletableFuture.completedFuture(
                ServiceHealth.failed(backend.name(), checkedAt, null, "not configured")
            );
        }
        long started = System.nanoTime();
        return CompletableFuture
            .supplyAsync(() -> {
                try {
                    return backend.generate(PROBE);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor)
            .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((text, error) -> classify(backend.name(), checkedAt, Duration.ofNanos(System.nanoTime() - started), text, error));
    }

    ServiceHealth classify(String name, Instant checkedAt, Duration latency, Optional<String> text, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            String message = cause instanceof TimeoutException
                ? "probe timed out after " + probeTimeout.toMillis() + " ms"
                : String.valueOf(cause.getMessage());
            LOG.warn("Health probe for {} failed: {}", name, message);
            return ServiceHealth.failed(name, checkedAt, latency, message);
        }
        boolean empty = text == null || text.isEmpty() || text.get().isBlank();
        if (empty || latency.compareTo(degradedThreshold) > 0) {
            return new ServiceHealth(name, HealthStatus.DEGRADED, checkedAt, latency,
                empty ? "empty response" : "slow response");
        }
        return ServiceHealth.of(name, HealthStatus.HEALTHY, checkedAt, latency);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
