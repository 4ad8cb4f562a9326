package io.switchback.core.orchestrator;

import io.switchback.core.backend.BackendFactory;
import io.switchback.core.backend.BackendRegistry;
import io.switchback.core.config.ConfigPaths;
import io.switchback.core.config.model.HealthConfig;
import io.switchback.core.config.model.SwitchbackConfig;
import io.switchback.core.fallback.FallbackResponseLoader;
import io.switchback.core.fallback.FallbackResponses;
import io.switchback.core.health.HealthMonitor;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Everything a process needs to serve completions for one configuration: the orchestrator and a
 * health monitor over the same backends.
 */
public final class SwitchbackRuntime implements AutoCloseable {
    private final SwitchbackConfig config;
    private final CompletionOrchestrator orchestrator;
    private final HealthMonitor healthMonitor;

    public SwitchbackRuntime(SwitchbackConfig config, CompletionOrchestrator orchestrator, HealthMonitor healthMonitor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor must not be null");
    }

    public static SwitchbackRuntime open(SwitchbackConfig config, BackendFactory backendFactory, Clock clock)
        throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(backendFactory, "backendFactory must not be null");
        BackendRegistry registry = backendFactory.build(config.backends());
        FallbackResponses responses = new FallbackResponseLoader()
            .load(ConfigPaths.resolve(config.routing().fallbackResponses()));
        CompletionOrchestrator orchestrator = CompletionOrchestrator.create(config.routing(), registry, responses, clock);
        return new SwitchbackRuntime(config, orchestrator, healthMonitor(config.health(), registry, clock));
    }

    private static HealthMonitor healthMonitor(HealthConfig health, BackendRegistry registry, Clock clock) {
        Duration probeTimeout = Duration.ofSeconds(health.probeTimeoutSeconds() > 0 ? health.probeTimeoutSeconds() : 10);
        Duration degraded = Duration.ofMillis(health.degradedThresholdMillis() > 0 ? health.degradedThresholdMillis() : 5_000);
        return new HealthMonitor(registry, probeTimeout, degraded, clock);
    }

    public SwitchbackConfig config() {
        return config;
    }

    public CompletionOrchestrator orchestrator() {
        return orchestrator;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    @Override
    public void close() {
        healthMonitor.close();
        orchestrator.close();
    }
}
