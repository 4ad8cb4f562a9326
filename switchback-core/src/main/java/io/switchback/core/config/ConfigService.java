package io.switchback.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.switchback.core.config.model.BackendsConfig;
import io.switchback.core.config.model.SwitchbackConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    public static final String OPENAI_API_KEY = "OPENAI_API_KEY";
    public static final String GOOGLE_API_KEY = "GOOGLE_API_KEY";
    public static final String ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    public static final String LOCAL_MODEL_PATH = "GPT4ALL_MODEL_PATH";

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public SwitchbackConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return SwitchbackConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(SwitchbackConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, SwitchbackConfig.class);
    }

    /**
     * Overlays credentials and the local model reference from environment variables. Blank values
     * are ignored.
     */
    public SwitchbackConfig withEnvironment(SwitchbackConfig config, Map<String, String> env) {
        Objects.requireNonNull(config, "config must not be null");
        if (env == null || env.isEmpty()) {
            return config;
        }
        BackendsConfig backends = config.backends();
        BackendsConfig overlaid = new BackendsConfig(
            present(env, LOCAL_MODEL_PATH) ? backends.local().withModelPath(env.get(LOCAL_MODEL_PATH)) : backends.local(),
            present(env, OPENAI_API_KEY) ? backends.openai().withApiKey(env.get(OPENAI_API_KEY)) : backends.openai(),
            present(env, GOOGLE_API_KEY) ? backends.gemini().withApiKey(env.get(GOOGLE_API_KEY)) : backends.gemini(),
            present(env, ANTHROPIC_API_KEY) ? backends.claude().withApiKey(env.get(ANTHROPIC_API_KEY)) : backends.claude()
        );
        return new SwitchbackConfig(overlaid, config.routing(), config.health(), config.gateway());
    }

    public void save(Path configPath, SwitchbackConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        SwitchbackConfig config;
        if (created || overwrite) {
            config = SwitchbackConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        return new InitResult(configPath, created, overwritten);
    }

    private boolean present(Map<String, String> env, String key) {
        String value = env.get(key);
        return value != null && !value.isBlank();
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
