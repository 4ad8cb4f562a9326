package io.switchback.cli;

import io.switchback.core.backend.GenerationRequest;
import io.switchback.core.config.model.SwitchbackConfig;
import io.switchback.core.orchestrator.SwitchbackRuntime;
import io.switchback.core.routing.CompletionOutcome;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ask", description = "Send a message and print the response")
public final class AskCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String message;

    @Option(names = {"-p", "--personality"}, description = "helpful, creative, analytical, fast or funny",
        defaultValue = "helpful")
    String personality;

    @Option(names = "--max-tokens", description = "Completion length limit", defaultValue = "150")
    int maxTokens;

    @Option(names = "--temperature", description = "Sampling temperature between 0 and 1", defaultValue = "0.7")
    double temperature;

    @Option(names = "--free-tier", description = "Apply free tier rate limits")
    boolean freeTier;

    @Option(names = {"-v", "--verbose"}, description = "Also print the backend used and the latency")
    boolean verbose;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        SwitchbackConfig config;
        try {
            config = context.loadConfig();
        } catch (Exception e) {
            System.err.println("Ask command failed: " + e.getMessage());
            return 1;
        }
        if (freeTier) {
            config = config.freeTier();
        }

        try (SwitchbackRuntime runtime = context.runtimeFactory().open(config)) {
            CompletionOutcome outcome = runtime.orchestrator()
                .complete(GenerationRequest.of(message, personality, maxTokens, temperature));
            System.out.println(outcome.text());
            if (verbose) {
                System.out.println("[backend: " + outcome.backendUsed() + ", latency: " + outcome.latency().toMillis() + " ms]");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Ask command failed: " + e.getMessage());
            return 1;
        }
    }
}
