package io.switchback.cli;

import io.switchback.core.health.HealthReport;
import io.switchback.core.health.HealthStatus;
import io.switchback.core.health.ServiceHealth;
import io.switchback.core.orchestrator.SwitchbackRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "health", description = "Probe every backend and print its health")
public final class HealthCommand implements Callable<Integer> {
    static final int UNHEALTHY_EXIT_CODE = 2;

    private final CliContext context;

    public HealthCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (SwitchbackRuntime runtime = context.runtimeFactory().open(context.loadConfig())) {
            HealthReport report = runtime.healthMonitor().check();
            for (ServiceHealth service : report.services()) {
                StringBuilder line = new StringBuilder()
                    .append(service.serviceName())
                    .append(": ")
                    .append(service.status().label());
                if (service.responseTime() != null) {
                    line.append(" (").append(service.responseTime().toMillis()).append(" ms)");
                }
                if (service.errorMessage() != null) {
                    line.append(" - ").append(service.errorMessage());
                }
                System.out.println(line);
            }
            System.out.println("Overall: " + report.status().label());
            return report.status() == HealthStatus.UNHEALTHY ? UNHEALTHY_EXIT_CODE : 0;
        } catch (Exception e) {
            System.err.println("Health command failed: " + e.getMessage());
            return 1;
        }
    }
}
