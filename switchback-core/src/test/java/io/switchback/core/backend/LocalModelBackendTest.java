package io.switchback.core.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class LocalModelBackendTest {

    @Test
    void shouldPrefixPromptWithPersonalitySentence() throws Exception {
        AtomicReference<String> seenPrompt = new AtomicReference<>();
        LocalModelRuntime runtime = modelRef -> (prompt, maxTokens, temperature) -> {
            seenPrompt.set(prompt);
            return "  local reply  ";
        };

        try (LocalModelBackend backend = new LocalModelBackend("local", runtime, "orca-mini:3b", Duration.ofSeconds(5))) {
            assertThat(backend.generate(GenerationRequest.of("tell me a joke", "funny", 20, 0.5))).contains("local reply");
        }
        assertThat(seenPrompt.get()).isEqualTo("You are a funny AI assistant. tell me a joke");
    }

    @Test
    void shouldDisableWhenModelFailsToLoad() {
        LocalModelRuntime runtime = modelRef -> {
            throw new IOException("no such model");
        };

        assertThatThrownBy(() -> new LocalModelBackend("local", runtime, "missing", Duration.ofSeconds(5)))
            .isInstanceOf(BackendConfigurationException.class)
            .hasMessageContaining("no such model");
    }

    @Test
    void shouldRejectBlankModelReference() {
        LocalModelRuntime runtime = modelRef -> (prompt, maxTokens, temperature) -> "unused";

        assertThatThrownBy(() -> new LocalModelBackend("local", runtime, " ", Duration.ofSeconds(5)))
            .isInstanceOf(BackendConfigurationException.class);
    }

    @Test
    void shouldTimeOutSlowGeneration() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        LocalModelRuntime runtime = modelRef -> (prompt, maxTokens, temperature) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "too late";
        };

        try (LocalModelBackend backend = new LocalModelBackend("local", runtime, "slow", Duration.ofMillis(100))) {
            assertThatThrownBy(() -> backend.generate(GenerationRequest.of("hi")))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("timed out");
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldWrapGenerationFailure() throws Exception {
        LocalModelRuntime runtime = modelRef -> (prompt, maxTokens, temperature) -> {
            throw new IOException("daemon went away");
        };

        try (LocalModelBackend backend = new LocalModelBackend("local", runtime, "orca", Duration.ofSeconds(5))) {
            assertThatThrownBy(() -> backend.generate(GenerationRequest.of("hi")))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("daemon went away");
        }
    }

    @Test
    void shouldReturnEmptyForBlankOutput() throws Exception {
        LocalModelRuntime runtime = modelRef -> (prompt, maxTokens, temperature) -> "\n";

        try (LocalModelBackend backend = new LocalModelBackend("local", runtime, "orca", Duration.ofSeconds(5))) {
            assertThat(backend.generate(GenerationRequest.of("hi"))).isEmpty();
        }
    }
}
