package io.switchback.core.backend;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class GenerationRequestTest {

    @Test
    void shouldApplyDefaults() {
        GenerationRequest request = GenerationRequest.of("hi");

        assertThat(request.personality()).isEqualTo(Personality.HELPFUL);
        assertThat(request.maxTokens()).isEqualTo(150);
        assertThat(request.temperature()).isEqualTo(0.7);
    }

    @Test
    void shouldClampOutOfRangeValues() {
        assertThat(GenerationRequest.of("x", "helpful", 0, 3.0).temperature()).isEqualTo(1.0);
        assertThat(GenerationRequest.of("x", "helpful", 0, 3.0).maxTokens()).isEqualTo(1);
        assertThat(GenerationRequest.of("x", "helpful", 10, -1.0).temperature()).isEqualTo(0.0);
        assertThat(GenerationRequest.of("x", "helpful", 10, Double.NaN).temperature()).isEqualTo(0.7);
    }

    @Test
    void shouldTreatNullMessageAsEmpty() {
        assertThat(new GenerationRequest(null, null, 10, 0.5).message()).isEmpty();
        assertThat(new GenerationRequest(null, null, 10, 0.5).personality()).isEqualTo(Personality.HELPFUL);
    }
}
