package com.powerguard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for PowerGuard.
 * Routes to subcommands: execute, history, probe, types, alerts, serve.
 */
@Command(
        name = "powerguard",
        mixinStandardHelpOptions = true,
        version = "PowerGuard 0.1.0",
        description = "Applies device optimization actionables with tiered OS access",
        subcommands = {
                ExecuteCommand.class,
                HistoryCommand.class,
                ProbeCommand.class,
                TypesCommand.class,
                AlertsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PowerGuardCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // Usage from the running CommandLine; a fresh one could not build the injected subcommands
        spec.commandLine().usage(System.out);
    }
}
