package com.roundabout.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: run, status, health.
 */
@Command(
        name = "roundabout",
        mixinStandardHelpOptions = true,
        version = "Roundabout 0.1.0",
        description = "Cognitive agent orchestration under a resource governor",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RoundaboutCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
