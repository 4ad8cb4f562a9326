package io.switchback.app;

import io.switchback.cli.AskCommand;
import io.switchback.cli.CliContext;
import io.switchback.cli.GatewayCommand;
import io.switchback.cli.HealthCommand;
import io.switchback.cli.InitCommand;
import io.switchback.cli.StatusCommand;
import io.switchback.cli.SwitchbackCliCommand;
import io.switchback.core.api.GatewayServer;
import io.switchback.core.backend.BackendFactory;
import io.switchback.core.backend.OllamaModelRuntime;
import io.switchback.core.config.ConfigPaths;
import io.switchback.core.config.ConfigService;
import io.switchback.core.config.model.LocalModelConfig;
import io.switchback.core.config.model.SwitchbackConfig;
import io.switchback.core.orchestrator.SwitchbackRuntime;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine;

public final class SwitchbackApplication {

    private SwitchbackApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            System.getenv(),
            SwitchbackApplication::openRuntime,
            SwitchbackApplication::runGateway
        );
        CommandLine commandLine = new CommandLine(new SwitchbackCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("ask", new AskCommand(context));
        commandLine.addSubcommand("health", new HealthCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("gateway", new GatewayCommand(context));
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static SwitchbackRuntime openRuntime(SwitchbackConfig config) throws IOException {
        LocalModelConfig local = config.backends().local();
        OllamaModelRuntime localRuntime = new OllamaModelRuntime(
            local.apiBase(),
            Duration.ofSeconds(local.timeoutSeconds() > 0 ? local.timeoutSeconds() : 60)
        );
        return SwitchbackRuntime.open(config, new BackendFactory(localRuntime), Clock.systemUTC());
    }

    private static int runGateway(SwitchbackConfig config, String host, int port) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        try (SwitchbackRuntime runtime = openRuntime(config);
             GatewayServer server = new GatewayServer(host, port, runtime.orchestrator(), runtime.healthMonitor())) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: GET /, GET /healthz, POST /chat, GET /stats");
            shutdown.await();
        }
        return 0;
    }
}
