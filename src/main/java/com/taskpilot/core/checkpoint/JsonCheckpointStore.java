package com.taskpilot.core.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.core.model.CheckpointLedger;
import com.taskpilot.core.model.ExecutionPhase;
import com.taskpilot.core.model.RecoveryInfo;
import com.taskpilot.core.model.TaskRecord;
import com.taskpilot.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * {@link CheckpointStore} backed by a single JSON file.
 *
 * <p>Each mutation replaces the in-memory ledger and rewrites the file through a
 * sibling temp file that is atomically moved over the target, so a reader sees either
 * the previous or the next ledger, never a torn one.
 *
 * <p>Opening the store performs crash recovery: if the previous session did not shut
 * down cleanly, every task left {@code in_progress} goes back to {@code pending} with
 * one more attempt counted.
 */
public class JsonCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JsonCheckpointStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;

    // what the file held when opened; only the first session reports it
    private final boolean openedAfterCleanShutdown;
    private final TaskRecord interruptedTask;
    private boolean sessionStarted;
    private CheckpointLedger ledger;

    JsonCheckpointStore(Path file, ObjectMapper mapper, Clock clock) {
        this.file = file;
        this.mapper = mapper;
        this.clock = clock;

        CheckpointLedger loaded = load();
        this.openedAfterCleanShutdown = loaded.cleanShutdown();

        TaskRecord interrupted = null;
        if (!loaded.cleanShutdown()) {
            var recovered = new ArrayList<TaskRecord>();
            for (TaskRecord task : loaded.tasks()) {
                if (task.state() == TaskState.IN_PROGRESS) {
                    if (interrupted == null) {
                        interrupted = task;
                    }
                    log.warn("Task {} was interrupted by an unclean shutdown, returning it to pending (attempts {} -> {})",
                            task.taskId(), task.attempts(), task.attempts() + 1);
                    recovered.add(task.requeued(true));
                } else {
                    recovered.add(task);
                }
            }
            loaded = loaded.withTasks(recovered);
        }
        this.interruptedTask = interrupted;
        this.ledger = loaded;
        persist();
    }

    public static JsonCheckpointStore open(Path file) {
        return new JsonCheckpointStore(file, CheckpointFiles.mapper(), Clock.systemUTC());
    }

    public static JsonCheckpointStore open(Path file, Clock clock) {
        return new JsonCheckpointStore(file, CheckpointFiles.mapper(), clock);
    }

    public Path file() {
        return file;
    }

    // -- Task operations --

    @Override
    public synchronized TaskRecord startTask(TaskRecord record) {
        Instant now = clock.instant();
        var tasks = new ArrayList<>(ledger.tasks());
        int index = indexOf(tasks, record.taskId(), record.text());
        TaskRecord started;
        if (index < 0) {
            started = record.started(1, now);
            tasks.add(started);
        } else {
            TaskRecord existing = tasks.get(index);
            if (existing.state() == TaskState.IN_PROGRESS) {
                throw new IllegalStateException("Task already in progress: " + existing.taskId());
            }
            if (existing.state() == TaskState.COMPLETED) {
                throw new IllegalStateException("Task already completed: " + existing.taskId());
            }
            // A pending record was either just queued or already charged by crash recovery.
            int attempts = existing.state() == TaskState.PENDING
                    ? Math.max(existing.attempts(), 1)
                    : existing.attempts() + 1;
            started = existing.started(attempts, now);
            tasks.set(index, started);
        }
        log.debug("Task {} started (attempt {})", started.taskId(), started.attempts());
        commit(ledger.withTasks(tasks));
        return started;
    }

    @Override
    public synchronized void endTask(String taskId, boolean success, String errorMessage) {
        TaskState terminal = success ? TaskState.COMPLETED : TaskState.FAILED;
        update(taskId, t -> t.finished(terminal, success ? null : errorMessage, clock.instant()));
        log.debug("Task {} ended as {}", taskId, terminal.value());
    }

    @Override
    public synchronized void skipTask(String taskId, String text, String reason) {
        var tasks = new ArrayList<>(ledger.tasks());
        int index = indexOf(tasks, taskId, text);
        TaskRecord base = index < 0 ? TaskRecord.queued(taskId, text) : tasks.get(index);
        TaskRecord skipped = base.finished(TaskState.SKIPPED, reason, clock.instant());
        if (index < 0) {
            tasks.add(skipped);
        } else {
            tasks.set(index, skipped);
        }
        commit(ledger.withTasks(tasks));
    }

    @Override
    public synchronized void suspendTask(String taskId) {
        update(taskId, t -> t.state() == TaskState.IN_PROGRESS ? t.requeued(false) : t);
    }

    @Override
    public synchronized void recordProgress(String taskId, ExecutionPhase phase, int instructionProgress,
                                            String category) {
        update(taskId, t -> t.progressed(phase, instructionProgress, category));
    }

    // -- Session operations --

    @Override
    public synchronized void markServerStart(String sessionId) {
        boolean previousClean = sessionStarted ? ledger.cleanShutdown() : openedAfterCleanShutdown;
        commit(ledger.withSessionStart(sessionId, clock.instant()));
        sessionStarted = true;
        log.info("Checkpoint session {} started (previous shutdown clean: {})", sessionId, previousClean);
    }

    @Override
    public synchronized void markServerStop(boolean clean, String reason) {
        commit(ledger.withSessionStop(clean, reason, clock.instant()));
        if (clean) {
            log.info("Checkpoint session {} stopped cleanly", ledger.sessionId());
        } else {
            log.warn("Checkpoint session {} stopped uncleanly: {}", ledger.sessionId(), reason);
        }
    }

    @Override
    public synchronized int incrementIteration() {
        int next = ledger.iterationCount() + 1;
        commit(ledger.withIterationCount(next));
        return next;
    }

    // -- Queries --

    @Override
    public synchronized boolean isTaskCompleted(String text) {
        return ledger.tasks().stream()
                .anyMatch(t -> t.state() == TaskState.COMPLETED && t.text().equals(text));
    }

    @Override
    public synchronized Optional<TaskRecord> findActiveByText(String text) {
        return ledger.tasks().stream()
                .filter(t -> t.text().equals(text) && t.state() != TaskState.COMPLETED)
                .findFirst();
    }

    @Override
    public synchronized Optional<TaskRecord> getTask(String taskId) {
        return ledger.tasks().stream().filter(t -> t.taskId().equals(taskId)).findFirst();
    }

    @Override
    public synchronized List<TaskRecord> getTasks() {
        return ledger.tasks();
    }

    @Override
    public synchronized List<TaskRecord> getCompletedTasks() {
        return withState(TaskState.COMPLETED);
    }

    @Override
    public synchronized RecoveryInfo getRecoveryInfo() {
        TaskRecord current = ledger.tasks().stream()
                .filter(t -> t.state() == TaskState.IN_PROGRESS)
                .findFirst()
                .orElse(sessionStarted ? null : interruptedTask);
        List<TaskRecord> incomplete = ledger.tasks().stream()
                .filter(t -> t.state() == TaskState.PENDING || t.state() == TaskState.IN_PROGRESS)
                .toList();
        return new RecoveryInfo(
                sessionStarted ? ledger.cleanShutdown() : openedAfterCleanShutdown,
                ledger.sessionId(),
                ledger.lastStartTime(),
                ledger.lastStopTime(),
                ledger.stopReason(),
                ledger.iterationCount(),
                incomplete,
                withState(TaskState.FAILED),
                current);
    }

    @Override
    public synchronized Statistics getStatistics() {
        return Statistics.of(ledger);
    }

    synchronized CheckpointLedger ledger() {
        return ledger;
    }

    // -- Internals --

    private List<TaskRecord> withState(TaskState state) {
        return ledger.tasks().stream().filter(t -> t.state() == state).toList();
    }

    private void update(String taskId, UnaryOperator<TaskRecord> change) {
        var tasks = new ArrayList<>(ledger.tasks());
        int index = indexOf(tasks, taskId, null);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        tasks.set(index, change.apply(tasks.get(index)));
        commit(ledger.withTasks(tasks));
    }

    private static int indexOf(List<TaskRecord> tasks, String taskId, String text) {
        for (int i = 0; i < tasks.size(); i++) {
            TaskRecord t = tasks.get(i);
            if (t.taskId().equals(taskId) || (text != null && t.text().equals(text))) {
                return i;
            }
        }
        return -1;
    }

    private void commit(CheckpointLedger next) {
        this.ledger = next;
        persist();
    }

    private void persist() {
        try {
            write(ledger);
        } catch (IOException first) {
            log.warn("Checkpoint write to {} failed, retrying once: {}", file, first.getMessage());
            try {
                write(ledger);
            } catch (IOException second) {
                second.addSuppressed(first);
                log.error("Checkpoint write to {} failed twice, durability lost", file, second);
                throw new CheckpointWriteException("Failed to persist checkpoint ledger to " + file, second);
            }
        }
    }

    private void write(CheckpointLedger snapshot) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(temp, mapper.writeValueAsBytes(snapshot));
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private CheckpointLedger load() {
        if (!Files.exists(file)) {
            log.info("No checkpoint at {}, starting with an empty ledger", file);
            return CheckpointLedger.empty();
        }
        try {
            return mapper.readValue(file.toFile(), CheckpointLedger.class);
        } catch (IOException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + clock.millis());
            log.error("Checkpoint {} is unreadable, moving it to {} and starting empty", file, aside, e);
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveFailure) {
                throw new CheckpointWriteException("Cannot move unreadable checkpoint aside: " + file, moveFailure);
            }
            return CheckpointLedger.empty();
        }
    }
}
