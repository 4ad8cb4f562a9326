package io.switchback.cli;

import picocli.CommandLine.Command;

@Command(name = "switchback", mixinStandardHelpOptions = true, version = "switchback 0.1.0",
    description = "Multi-backend AI completions with automatic fallback")
public final class SwitchbackCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
