package com.hivemind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Hivemind.
 * Routes to subcommands: agents, simulate, health.
 */
@Command(
        name = "hivemind",
        mixinStandardHelpOptions = true,
        version = "Hivemind 0.1.0",
        description = "Agent task orchestrator: capability matching, adaptive learning and pool scaling",
        subcommands = {
                AgentsCommand.class,
                SimulateCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HivemindCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
