package io.switchback.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;

public final class ClaudeBackend extends HostedBackend {
    public static final String DEFAULT_API_BASE = "https://api.anthropic.com/v1";
    private static final String API_VERSION = "2023-06-01";

    private static final PersonalityPrompts PROMPTS = PersonalityPrompts.of(Map.of(
        Personality.HELPFUL, "You are a helpful AI assistant.",
        Personality.CREATIVE, "You are a creative AI assistant who excels at generating innovative solutions.",
        Personality.ANALYTICAL, "You are an analytical AI assistant who provides detailed, logical analysis.",
        Personality.FUNNY, "You are a funny AI assistant who brings humor and wit to conversations."
    ));

    public ClaudeBackend(String name, String apiKey, String apiBase, String model, Duration timeout)
        throws BackendConfigurationException {
        super(name, apiKey, apiBase, model, timeout, PROMPTS);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.CLAUDE;
    }

    @Override
    protected HttpUrl endpoint() {
        return apiBase().newBuilder()
            .addPathSegment("messages")
            .build();
    }

    @Override
    protected Map<String, String> authHeaders() {
        return Map.of(
            "x-api-key", apiKey(),
            "anthropic-version", API_VERSION
        );
    }

    @Override
    protected Map<String, Object> payload(GenerationRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model());
        payload.put("max_tokens", request.maxTokens());
        payload.put("temperature", request.temperature());
        payload.put("system", systemPrompt(request.personality()));
        payload.put("messages", List.of(Map.of("role", "user", "content", request.message())));
        return payload;
    }

    @Override
    protected String extractText(JsonNode root) throws BackendException {
        JsonNode content = root.path("content");
        if (!content.isArray()) {
            throw new BackendException(name(), "malformed payload: missing content");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode item : content) {
            if ("text".equals(item.path("type").asText(""))) {
                text.append(item.path("text").asText(""));
            }
        }
        return text.toString();
    }
}
