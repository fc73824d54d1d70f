package com.taskpilot.dispatch.cli;

import com.taskpilot.core.checkpoint.CheckpointFiles;
import com.taskpilot.core.checkpoint.CheckpointProperties;
import com.taskpilot.core.checkpoint.CheckpointStore;
import com.taskpilot.core.model.CheckpointLedger;
import com.taskpilot.core.model.TaskRecord;
import com.taskpilot.core.todo.ProjectProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: taskpilot status
 * <p>
 * Reads the checkpoint file without opening the store, so it never triggers crash
 * recovery and is safe to run next to a live orchestrator.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show checkpoint status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--all", "-a"}, description = "List completed tasks too")
    private boolean all;

    private final ProjectProperties project;
    private final CheckpointProperties checkpoint;

    public StatusCommand(ProjectProperties project, CheckpointProperties checkpoint) {
        this.project = project;
        this.checkpoint = checkpoint;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path file = project.resolve(checkpoint.getFile());

        Optional<CheckpointLedger> read;
        try {
            read = CheckpointFiles.read(file);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read checkpoint " + file + ": " + e.getMessage());
            return 1;
        }
        if (read.isEmpty()) {
            ConsoleOutput.info("No checkpoint yet at " + file);
            return 0;
        }

        CheckpointLedger ledger = read.get();
        System.out.println();
        System.out.println("SESSION " + (ledger.sessionId() != null ? ledger.sessionId() : "-"));
        System.out.println("Started: " + orDash(ledger.lastStartTime()));
        System.out.println("Stopped: " + orDash(ledger.lastStopTime())
                + (ledger.stopReason() != null ? " (" + ledger.stopReason() + ")" : ""));
        if (ledger.cleanShutdown()) {
            ConsoleOutput.success("Last shutdown: clean");
        } else {
            ConsoleOutput.error("Last shutdown: not clean (running, or crashed)");
        }

        var stats = CheckpointStore.Statistics.of(ledger);
        ConsoleOutput.info(String.format("Tasks: %d total, %d pending, %d in progress, %d completed, %d failed, %d skipped",
                stats.total(), stats.pending(), stats.inProgress(), stats.completed(), stats.failed(),
                stats.skipped()));
        ConsoleOutput.info("Iterations: " + stats.iterationCount());

        var shown = ledger.tasks().stream()
                .filter(t -> all || !"completed".equals(t.state().value()))
                .toList();
        if (!shown.isEmpty()) {
            System.out.println();
            System.out.printf("  %-20s %-12s %-8s %-5s %s%n", "TASK", "STATE", "ATTEMPTS", "STEP", "TEXT");
            System.out.println("  " + "-".repeat(72));
            for (TaskRecord t : shown) {
                ConsoleOutput.taskState(t.state().value(), t.taskId(), t.attempts(), t.instructionProgress(), t.text());
                if (t.errorMessage() != null) {
                    System.out.println("      " + ConsoleOutput.truncate(t.errorMessage(), 70));
                }
            }
        }
        return 0;
    }

    private static String orDash(Object value) {
        return value != null ? value.toString() : "-";
    }
}
