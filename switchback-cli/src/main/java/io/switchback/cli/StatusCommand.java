package io.switchback.cli;

import io.switchback.core.config.model.BackendsConfig;
import io.switchback.core.config.model.RoutingConfig;
import io.switchback.core.config.model.SwitchbackConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SwitchbackConfig config = context.loadConfig();
            BackendsConfig backends = config.backends();
            RoutingConfig routing = config.routing();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Local model configured: " + backends.local().configured()
                + " (" + backends.local().modelPath() + " via " + backends.local().apiBase() + ")");
            System.out.println("OpenAI configured: " + backends.openai().configured() + " (" + backends.openai().model() + ")");
            System.out.println("Gemini configured: " + backends.gemini().configured() + " (" + backends.gemini().model() + ")");
            System.out.println("Claude configured: " + backends.claude().configured() + " (" + backends.claude().model() + ")");
            System.out.println("Priority: " + String.join(", ", routing.priority()));
            System.out.println("Rate limits: " + (routing.rateLimited() ? routing.rateLimits() : "none"));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
