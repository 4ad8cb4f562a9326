package io.switchback.core.backend;

import io.switchback.core.config.model.BackendsConfig;
import io.switchback.core.config.model.HostedBackendConfig;
import io.switchback.core.config.model.LocalModelConfig;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the four standard backends. A backend that cannot be constructed is replaced by a
 * {@link DisabledBackend} and stays disabled until restart.
 */
public final class BackendFactory {
    private static final Logger LOG = LoggerFactory.getLogger(BackendFactory.class);

    public static final String LOCAL = "local";
    public static final String OPENAI = "openai";
    public static final String GEMINI = "gemini";
    public static final String CLAUDE = "claude";

    private final LocalModelRuntime localRuntime;

    public BackendFactory(LocalModelRuntime localRuntime) {
        this.localRuntime = Objects.requireNonNull(localRuntime, "localRuntime must not be null");
    }

    public BackendRegistry build(BackendsConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        List<Backend> backends = List.of(
            buildLocal(config.local()),
            buildOpenAi(config.openai()),
            buildGemini(config.gemini()),
            buildClaude(config.claude())
        );
        long available = backends.stream().filter(Backend::isAvailable).count();
        LOG.info("Initialized {} of {} backends", available, backends.size());
        return new BackendRegistry(backends);
    }

    Backend buildLocal(LocalModelConfig config) {
        try {
            if (config == null) {
                throw new BackendConfigurationException("missing configuration");
            }
            return new LocalModelBackend(LOCAL, localRuntime, config.modelPath(), seconds(config.timeoutSeconds()));
        } catch (BackendConfigurationException e) {
            return disabled(LOCAL, BackendKind.LOCAL, e);
        }
    }

    Backend buildOpenAi(HostedBackendConfig config) {
        try {
            requireConfig(config);
            return new OpenAiBackend(OPENAI, config.apiKey(), baseOr(config, OpenAiBackend.DEFAULT_API_BASE),
                config.model(), seconds(config.timeoutSeconds()));
        } catch (BackendConfigurationException e) {
            return disabled(OPENAI, BackendKind.OPENAI, e);
        }
    }

    Backend buildGemini(HostedBackendConfig config) {
        try {
            requireConfig(config);
            return new GeminiBackend(GEMINI, config.apiKey(), baseOr(config, GeminiBackend.DEFAULT_API_BASE),
                config.model(), seconds(config.timeoutSeconds()));
        } catch (BackendConfigurationException e) {
            return disabled(GEMINI, BackendKind.GEMINI, e);
        }
    }

    Backend buildClaude(HostedBackendConfig config) {
        try {
            requireConfig(config);
            return new ClaudeBackend(CLAUDE, config.apiKey(), baseOr(config, ClaudeBackend.DEFAULT_API_BASE),
                config.model(), seconds(config.timeoutSeconds()));
        } catch (BackendConfigurationException e) {
            return disabled(CLAUDE, BackendKind.CLAUDE, e);
        }
    }

    private void requireConfig(HostedBackendConfig config) throws BackendConfigurationException {
        if (config == null) {
            throw new BackendConfigurationException("missing configuration");
        }
    }

    private Backend disabled(String name, BackendKind kind, BackendConfigurationException cause) {
        LOG.warn("Backend {} disabled: {}", name, cause.getMessage());
        return new DisabledBackend(name, kind, cause.getMessage());
    }

    private String baseOr(HostedBackendConfig config, String fallback) {
        return config.apiBase() == null || config.apiBase().isBlank() ? fallback : config.apiBase();
    }

    private Duration seconds(int value) {
        return value <= 0 ? null : Duration.ofSeconds(value);
    }
}
