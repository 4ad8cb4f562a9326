package io.switchback.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HostedBackendConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static HostedBackendConfig defaults(String apiBase, String model) {
        return new HostedBackendConfig("", apiBase, model, 30);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public HostedBackendConfig withApiKey(String key) {
        return new HostedBackendConfig(key, apiBase, model, timeoutSeconds);
    }

    public HostedBackendConfig withModel(String newModel) {
        return new HostedBackendConfig(apiKey, apiBase, newModel, timeoutSeconds);
    }
}
