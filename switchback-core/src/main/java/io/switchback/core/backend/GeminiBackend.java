package io.switchback.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;

public final class GeminiBackend extends HostedBackend {
    public static final String DEFAULT_API_BASE = "https://generativelanguage.googleapis.com/v1beta";

    private static final PersonalityPrompts PROMPTS = PersonalityPrompts.of(Map.of(
        Personality.HELPFUL, "You are a helpful AI assistant.",
        Personality.CREATIVE, "You are a creative AI assistant who generates innovative ideas.",
        Personality.ANALYTICAL, "You are an analytical AI assistant who provides thorough analysis.",
        Personality.FUNNY, "You are a funny AI assistant who adds humor to conversations."
    ));

    public GeminiBackend(String name, String apiKey, String apiBase, String model, Duration timeout)
        throws BackendConfigurationException {
        super(name, apiKey, apiBase, model, timeout, PROMPTS);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.GEMINI;
    }

    @Override
    protected HttpUrl endpoint() {
        return apiBase().newBuilder()
            .addPathSegment("models")
            .addPathSegment(model() + ":generateContent")
            .build();
    }

    @Override
    protected Map<String, String> authHeaders() {
        return Map.of("x-goog-api-key", apiKey());
    }

    @Override
    protected Map<String, Object> payload(GenerationRequest request) {
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", request.maxTokens());
        generationConfig.put("temperature", request.temperature());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("systemInstruction", Map.of(
            "parts", List.of(Map.of("text", systemPrompt(request.personality())))
        ));
        payload.put("contents", List.of(Map.of(
            "role", "user",
            "parts", List.of(Map.of("text", request.message()))
        )));
        payload.put("generationConfig", generationConfig);
        return payload;
    }

    @Override
    protected String extractText(JsonNode root) throws BackendException {
        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray()) {
            throw new BackendException(name(), "malformed payload: missing candidates");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidates.path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }
}
