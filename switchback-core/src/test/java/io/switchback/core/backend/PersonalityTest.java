package io.switchback.core.backend;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PersonalityTest {

    @Test
    void shouldResolveKnownTagsIgnoringCase() {
        assertThat(Personality.fromTag("creative")).isEqualTo(Personality.CREATIVE);
        assertThat(Personality.fromTag(" Analytical ")).isEqualTo(Personality.ANALYTICAL);
        assertThat(Personality.fromTag("FAST")).isEqualTo(Personality.FAST);
    }

    @Test
    void shouldFallBackToHelpfulForUnknownTags() {
        assertThat(Personality.fromTag("grumpy")).isEqualTo(Personality.HELPFUL);
        assertThat(Personality.fromTag("")).isEqualTo(Personality.HELPFUL);
        assertThat(Personality.fromTag(null)).isEqualTo(Personality.HELPFUL);
    }

    @Test
    void shouldUseHelpfulPromptWhenPersonalityHasNoEntry() {
        PersonalityPrompts prompts = PersonalityPrompts.of(java.util.Map.of(
            Personality.HELPFUL, "helpful prompt",
            Personality.FUNNY, "funny prompt"
        ));

        assertThat(prompts.promptFor(Personality.FUNNY)).isEqualTo("funny prompt");
        assertThat(prompts.promptFor(Personality.FAST)).isEqualTo("helpful prompt");
    }
}
