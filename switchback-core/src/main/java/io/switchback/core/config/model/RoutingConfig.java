package io.switchback.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingConfig(
    List<String> priority,
    @JsonAlias({"rate_limits"}) Map<String, Integer> rateLimits,
    @JsonAlias({"rate_window_seconds"}) int rateWindowSeconds,
    @JsonAlias({"fallback_responses"}) String fallbackResponses
) {

    public RoutingConfig {
        priority = priority == null ? List.of() : List.copyOf(priority);
        rateLimits = rateLimits == null ? Map.of() : Map.copyOf(rateLimits);
    }

    public static RoutingConfig defaults() {
        return new RoutingConfig(List.of("local", "openai", "gemini", "claude"), Map.of(), 60, "");
    }

    public boolean rateLimited() {
        return !rateLimits.isEmpty();
    }
}
