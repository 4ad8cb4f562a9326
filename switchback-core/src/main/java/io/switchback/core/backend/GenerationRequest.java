package io.switchback.core.backend;

public record GenerationRequest(String message, Personality personality, int maxTokens, double temperature) {
    public static final int DEFAULT_MAX_TOKENS = 150;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public GenerationRequest {
        message = message == null ? "" : message;
        personality = personality == null ? Personality.HELPFUL : personality;
        maxTokens = Math.max(1, maxTokens);
        if (Double.isNaN(temperature)) {
            temperature = DEFAULT_TEMPERATURE;
        }
        temperature = Math.min(1.0, Math.max(0.0, temperature));
    }

    public static GenerationRequest of(String message) {
        return new GenerationRequest(message, Personality.HELPFUL, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE);
    }

    public static GenerationRequest of(String message, String personality, int maxTokens, double temperature) {
        return new GenerationRequest(message, Personality.fromTag(personality), maxTokens, temperature);
    }
}
