package io.switchback.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthConfig(
    @JsonAlias({"probe_timeout_seconds"}) int probeTimeoutSeconds,
    @JsonAlias({"degraded_threshold_millis"}) long degradedThresholdMillis
) {

    public static HealthConfig defaults() {
        return new HealthConfig(10, 5_000);
    }
}
