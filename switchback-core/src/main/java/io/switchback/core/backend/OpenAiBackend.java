package io.switchback.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;

public final class OpenAiBackend extends HostedBackend {
    public static final String DEFAULT_API_BASE = "https://api.openai.com/v1";

    private static final PersonalityPrompts PROMPTS = PersonalityPrompts.of(Map.of(
        Personality.HELPFUL, "You are a helpful AI assistant.",
        Personality.CREATIVE, "You are a creative AI assistant who thinks outside the box.",
        Personality.ANALYTICAL, "You are an analytical AI assistant who provides detailed analysis.",
        Personality.FUNNY, "You are a funny AI assistant who uses humor in responses."
    ));

    public OpenAiBackend(String name, String apiKey, String apiBase, String model, Duration timeout)
        throws BackendConfigurationException {
        super(name, apiKey, apiBase, model, timeout, PROMPTS);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.OPENAI;
    }

    @Override
    protected HttpUrl endpoint() {
        return apiBase().newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    @Override
    protected Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + apiKey());
    }

    @Override
    protected Map<String, Object> payload(GenerationRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model());
        payload.put("messages", List.of(
            Map.of("role", "system", "content", systemPrompt(request.personality())),
            Map.of("role", "user", "content", request.message())
        ));
        payload.put("max_tokens", request.maxTokens());
        payload.put("temperature", request.temperature());
        return payload;
    }

    @Override
    protected String extractText(JsonNode root) throws BackendException {
        JsonNode choices = root.path("choices");
        if (!choices.isArray()) {
            throw new BackendException(name(), "malformed payload: missing choices");
        }
        JsonNode content = choices.path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
