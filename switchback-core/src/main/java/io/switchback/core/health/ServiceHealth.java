package io.switchback.core.health;

import java.time.Duration;
import java.time.Instant;

public record ServiceHealth(
    String serviceName,
    HealthStatus status,
    Instant lastCheck,
    Duration responseTime,
    String errorMessage
) {

    public static ServiceHealth of(String serviceName, HealthStatus status, Instant lastCheck, Duration responseTime) {
        return new ServiceHealth(serviceName, status, lastCheck, responseTime, null);
    }

    public static ServiceHealth failed(String serviceName, Instant lastCheck, Duration responseTime, String errorMessage) {
        return new ServiceHealth(serviceName, HealthStatus.UNHEALTHY, lastCheck, responseTime, errorMessage);
    }
}
