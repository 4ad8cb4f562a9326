package io.switchback.core.fallback;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FallbackResponseLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPreferConfiguredFile() throws Exception {
        Path file = tempDir.resolve("responses.json");
        Files.writeString(file, "{\"greeting\":\"Howdy\",\"error\":\"Broken\"}", StandardCharsets.UTF_8);

        FallbackResponses responses = new FallbackResponseLoader().load(file);

        assertThat(responses.lookup("greeting")).isEqualTo("Howdy");
        assertThat(responses.lookup("busy")).isEqualTo("Broken");
    }

    @Test
    void shouldUseBundledResourceWhenFileIsMissing() throws Exception {
        FallbackResponses responses = new FallbackResponseLoader().load(tempDir.resolve("missing.json"));

        assertThat(responses.contains("chat_unavailable")).isTrue();
        assertThat(responses.size()).isEqualTo(5);
    }

    @Test
    void shouldUseDefaultsWhenNothingLoads() throws Exception {
        FallbackResponses responses = new FallbackResponseLoader("no-such-resource.json").load(null);

        assertThat(responses.size()).isEqualTo(4);
        assertThat(responses.lookup("greeting")).isEqualTo("Hello! I'm your AI assistant. How can I help you today?");
    }
}
