package com.taskpilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for TaskPilot.
 * Routes to subcommands: run, serve, status, health.
 */
@Command(
        name = "taskpilot",
        mixinStandardHelpOptions = true,
        version = "TaskPilot 0.1.0",
        description = "Works through a TODO list by driving an external coding agent",
        subcommands = {
                RunCommand.class,
                ServeCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskPilotCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
