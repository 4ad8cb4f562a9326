package io.switchback.cli;

import io.switchback.core.config.model.SwitchbackConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "gateway", description = "Start the HTTP gateway for chat, health and stats")
public final class GatewayCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Gateway port, defaults to the configured one")
    Integer port;

    @Option(names = {"--host"}, description = "Bind address, defaults to the configured one")
    String host;

    @Option(names = "--free-tier", description = "Apply free tier rate limits")
    boolean freeTier;

    public GatewayCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SwitchbackConfig config = context.loadConfig();
            if (freeTier) {
                config = config.freeTier();
            }
            String bindHost = host != null ? host : config.gateway().host();
            int bindPort = port != null ? port : config.gateway().port();
            return context.gatewayRunner().run(config, bindHost, bindPort);
        } catch (Exception e) {
            System.err.println("Gateway command failed: " + e.getMessage());
            return 1;
        }
    }
}
