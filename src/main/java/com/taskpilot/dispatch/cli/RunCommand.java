package com.taskpilot.dispatch.cli;

import com.taskpilot.core.engine.OrchestratorRunner;
import com.taskpilot.core.todo.ProjectProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: taskpilot run
 * <p>
 * Runs the orchestration loop in the foreground until a stop. Exit code 0 after an
 * orderly stop (Ctrl+C included), 1 after a critical one.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Work through the TODO list in the foreground")
@Component
public class RunCommand implements Callable<Integer> {

    private final OrchestratorRunner runner;
    private final ProjectProperties project;

    public RunCommand(OrchestratorRunner runner, ProjectProperties project) {
        this.runner = runner;
        this.project = project;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Project: " + project.projectDir());
        ConsoleOutput.info("TODO:    " + project.todoPath());
        ConsoleOutput.info("Press Ctrl+C to stop after the current step.");
        int code = runner.run();
        if (code == 0) {
            ConsoleOutput.success("Stopped cleanly");
        } else {
            ConsoleOutput.error("Stopped after a critical error, see " + project.statusPath());
        }
        return code;
    }
}
