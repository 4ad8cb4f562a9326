package io.switchback.cli;

import io.switchback.core.config.ConfigService;
import io.switchback.core.config.model.SwitchbackConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    RuntimeFactory runtimeFactory,
    GatewayRunner gatewayRunner
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliContext(ConfigService configService, Path configPath, RuntimeFactory runtimeFactory) {
        this(configService, configPath, Map.of(), runtimeFactory, (config, host, port) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }

    /**
     * Configuration file merged over defaults, then overlaid with credentials from the environment.
     */
    public SwitchbackConfig loadConfig() throws IOException {
        return configService.withEnvironment(configService.load(configPath), environment);
    }
}
