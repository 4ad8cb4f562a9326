package io.switchback.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LocalModelConfig(
    @JsonAlias({"model_path"}) String modelPath,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static LocalModelConfig defaults() {
        return new LocalModelConfig("orca-mini:3b", "http://127.0.0.1:11434", 60);
    }

    public boolean configured() {
        return modelPath != null && !modelPath.isBlank();
    }

    public LocalModelConfig withModelPath(String path) {
        return new LocalModelConfig(path, apiBase, timeoutSeconds);
    }
}
