package com.devkit.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to run, status, abort, release and health.
 */
@Command(
        name = "devkit",
        mixinStandardHelpOptions = true,
        version = "devkit 0.1.0",
        description = "Executes a ticket breakdown task by task in an isolated git worktree",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                AbortCommand.class,
                ReleaseCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DevkitCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
