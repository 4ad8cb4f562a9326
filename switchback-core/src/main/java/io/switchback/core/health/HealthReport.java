package io.switchback.core.health;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record HealthReport(HealthStatus status, Instant timestamp, List<ServiceHealth> services, Duration uptime) {

    public HealthReport {
        services = services == null ? List.of() : List.copyOf(services);
    }

    public static HealthReport aggregate(Instant timestamp, List<ServiceHealth> services, Duration uptime) {
        HealthStatus overall = HealthStatus.worst(services.stream().map(ServiceHealth::status).toList());
        return new HealthReport(overall, timestamp, services, uptime);
    }
}
