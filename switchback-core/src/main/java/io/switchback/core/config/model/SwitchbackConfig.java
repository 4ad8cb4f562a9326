package io.switchback.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SwitchbackConfig(
    BackendsConfig backends,
    RoutingConfig routing,
    HealthConfig health,
    GatewayConfig gateway
) {
    public static final Map<String, Integer> FREE_TIER_LIMITS = Map.of(
        "openai", 3,
        "gemini", 15,
        "claude", 5
    );
    public static final String FREE_TIER_OPENAI_MODEL = "gpt-3.5-turbo";

    public static SwitchbackConfig defaults() {
        return new SwitchbackConfig(
            BackendsConfig.defaults(),
            RoutingConfig.defaults(),
            HealthConfig.defaults(),
            GatewayConfig.defaults()
        );
    }

    /**
     * Copy of this configuration with the free tier rate limits and the cheaper OpenAI model.
     */
    public SwitchbackConfig freeTier() {
        BackendsConfig freeBackends = new BackendsConfig(
            backends.local(),
            backends.openai().withModel(FREE_TIER_OPENAI_MODEL),
            backends.gemini(),
            backends.claude()
        );
        RoutingConfig freeRouting = new RoutingConfig(
            routing.priority(),
            FREE_TIER_LIMITS,
            routing.rateWindowSeconds(),
            routing.fallbackResponses()
        );
        return new SwitchbackConfig(freeBackends, freeRouting, health, gateway);
    }
}
