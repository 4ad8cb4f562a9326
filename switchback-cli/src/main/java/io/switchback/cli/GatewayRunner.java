package io.switchback.cli;

import io.switchback.core.config.model.SwitchbackConfig;

@FunctionalInterface
public interface GatewayRunner {
    int run(SwitchbackConfig config, String host, int port) throws Exception;
}
