package io.switchback.cli;

import io.switchback.core.config.model.SwitchbackConfig;
import io.switchback.core.orchestrator.SwitchbackRuntime;
import java.io.IOException;

@FunctionalInterface
public interface RuntimeFactory {
    SwitchbackRuntime open(SwitchbackConfig config) throws IOException;
}
