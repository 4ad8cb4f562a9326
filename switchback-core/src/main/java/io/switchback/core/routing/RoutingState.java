package io.switchback.core.routing;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Last-used backend and last observed latency per backend, shared by all requests of one
 * orchestrator. Every access holds this object's monitor.
 */
public final class RoutingState {
    private String lastUsed;
    private final Map<String, Duration> latencies = new LinkedHashMap<>();

    public synchronized String lastUsed() {
        return lastUsed;
    }

    public synchronized void recordSuccess(String backend, Duration latency) {
        latencies.put(backend, latency);
        lastUsed = backend;
    }

    public synchronized Map<String, Duration> latencies() {
        return Map.copyOf(latencies);
    }
}
