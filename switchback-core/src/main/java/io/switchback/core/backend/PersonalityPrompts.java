package io.switchback.core.backend;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per backend lookup from personality to system prompt. Missing entries resolve to the helpful prompt.
 */
public final class PersonalityPrompts {
    private final Map<Personality, String> prompts;

    private PersonalityPrompts(Map<Personality, String> prompts) {
        this.prompts = prompts;
    }

    public static PersonalityPrompts of(Map<Personality, String> prompts) {
        Objects.requireNonNull(prompts, "prompts must not be null");
        if (!prompts.containsKey(Personality.HELPFUL)) {
            throw new IllegalArgumentException("a helpful prompt is required");
        }
        return new PersonalityPrompts(new EnumMap<>(prompts));
    }

    public String promptFor(Personality personality) {
        String prompt = personality == null ? null : prompts.get(personality);
        return prompt != null ? prompt : prompts.get(Personality.HELPFUL);
    }
}
