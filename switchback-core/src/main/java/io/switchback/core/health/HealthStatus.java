package io.switchback.core.health;

import java.util.Collection;
import java.util.Locale;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Worst status of the collection; an empty collection is healthy.
     */
    public static HealthStatus worst(Collection<HealthStatus> statuses) {
        HealthStatus worst = HEALTHY;
        for (HealthStatus status : statuses) {
            if (status != null && status.ordinal() > worst.ordinal()) {
                worst = status;
            }
        }
        return worst;
    }
}
