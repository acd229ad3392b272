package com.conductor.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 */
@Command(
        name = "conductor",
        mixinStandardHelpOptions = true,
        version = "Conductor 0.1.0",
        description = "Start, stop and supervise interdependent containerized services",
        subcommands = {
                StartCommand.class,
                StopCommand.class,
                RestartCommand.class,
                StatusCommand.class,
                MonitorCommand.class,
                DepsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ConductorCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // reuse the CommandLine built with the Spring-aware factory
        spec.commandLine().usage(System.out);
    }
}
