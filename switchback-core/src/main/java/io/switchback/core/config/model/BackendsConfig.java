package io.switchback.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendsConfig(
    LocalModelConfig local,
    HostedBackendConfig openai,
    HostedBackendConfig gemini,
    HostedBackendConfig claude
) {

    public static BackendsConfig defaults() {
        return new BackendsConfig(
            LocalModelConfig.defaults(),
            HostedBackendConfig.defaults("https://api.openai.com/v1", "gpt-4"),
            HostedBackendConfig.defaults("https://generativelanguage.googleapis.com/v1beta", "gemini-pro"),
            HostedBackendConfig.defaults("https://api.anthropic.com/v1", "claude-3-sonnet-20240229")
        );
    }
}
