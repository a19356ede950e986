package com.desweep.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for desweep.
 * Routes to subcommands: analyze, cache, health.
 */
@Command(
        name = "desweep",
        mixinStandardHelpOptions = true,
        version = "desweep 0.1.0",
        description = "Checks whether data extensions are still referenced before deletion",
        subcommands = {
                AnalyzeCommand.class,
                CacheCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DesweepCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
