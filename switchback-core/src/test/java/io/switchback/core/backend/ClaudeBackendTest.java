package io.switchback.core.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClaudeBackendTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldConcatenateTextBlocksOnly() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "content": [
                    { "type": "text", "text": "Step one. " },
                    { "type": "tool_use", "id": "t1", "name": "noop", "input": {} },
                    { "type": "text", "text": "Step two." }
                  ]
                }
                """));

        ClaudeBackend backend = backend();

        assertThat(backend.generate(GenerationRequest.of("explain", "analytical", 100, 0.2)))
            .contains("Step one. Step two.");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("sk-ant");
        assertThat(request.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        assertThat(request.getBody().readUtf8())
            .contains("\"model\":\"claude-3-sonnet-20240229\"")
            .contains("\"system\":\"You are an analytical AI assistant");
    }

    @Test
    void shouldFailOnServerError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(529).setBody("overloaded"));

        assertThatThrownBy(() -> backend().generate(GenerationRequest.of("hi")))
            .isInstanceOf(BackendException.class)
            .hasMessageContaining("HTTP 529")
            .hasMessageContaining("overloaded");
    }

    @Test
    void shouldReturnEmptyWhenNoTextBlocks() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"content\":[]}"));

        assertThat(backend().generate(GenerationRequest.of("hi"))).isEmpty();
    }

    private ClaudeBackend backend() throws BackendConfigurationException {
        return new ClaudeBackend("claude", "sk-ant", server.url("/v1").toString(), "claude-3-sonnet-20240229",
            Duration.ofSeconds(5));
    }
}
