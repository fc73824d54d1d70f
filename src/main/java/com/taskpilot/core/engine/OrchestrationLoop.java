package com.taskpilot.core.engine;

import com.taskpilot.core.checkpoint.CheckpointStore;
import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.events.TaskPilotEvent;
import com.taskpilot.core.lifecycle.LifecycleFlags;
import com.taskpilot.core.lifecycle.ReloadRequestedException;
import com.taskpilot.core.logging.MdcContext;
import com.taskpilot.core.metrics.TaskPilotMetrics;
import com.taskpilot.core.model.ControlCommand;
import com.taskpilot.core.model.RecoveryInfo;
import com.taskpilot.core.model.TaskOutcome;
import com.taskpilot.core.model.TaskRecord;
import com.taskpilot.core.model.TodoItem;
import com.taskpilot.core.status.StatusTrail;
import com.taskpilot.core.todo.TodoSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The main scan-and-execute loop of one session.
 *
 * <p>Each iteration drains queued control commands, builds a pass from the pending TODO
 * items that the ledger has not completed, and drives them one at a time through the
 * {@link TaskStateMachine}. Lifecycle flags are checked at the top of every iteration and
 * between tasks. A stop ends {@link #run} normally; a reload ends it with
 * {@link ReloadRequestedException} so the owner can restart with a fresh session.
 */
@Component
public class OrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoop.class);

    private final CheckpointStore store;
    private final TodoSource todo;
    private final TaskStateMachine stateMachine;
    private final ContinuationAdvisor advisor;
    private final LifecycleFlags flags;
    private final EventBus eventBus;
    private final StatusTrail statusTrail;
    private final TaskPilotMetrics metrics;
    private final LoopProperties properties;
    private final Clock clock;

    public OrchestrationLoop(CheckpointStore store, TodoSource todo, TaskStateMachine stateMachine,
                             ContinuationAdvisor advisor, LifecycleFlags flags, EventBus eventBus,
                             StatusTrail statusTrail, TaskPilotMetrics metrics, LoopProperties properties,
                             Clock clock) {
        this.store = store;
        this.todo = todo;
        this.stateMachine = stateMachine;
        this.advisor = advisor;
        this.flags = flags;
        this.eventBus = eventBus;
        this.statusTrail = statusTrail;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    @Autowired
    public OrchestrationLoop(@Lazy CheckpointStore store, @Lazy TodoSource todo, TaskStateMachine stateMachine,
                             ContinuationAdvisor advisor, LifecycleFlags flags, EventBus eventBus,
                             StatusTrail statusTrail, TaskPilotMetrics metrics, LoopProperties properties) {
        this(store, todo, stateMachine, advisor, flags, eventBus, statusTrail, metrics, properties,
                Clock.systemUTC());
    }

    /**
     * Runs until a stop is requested.
     *
     * @return true if the stop was orderly, false if it was critical
     * @throws ReloadRequestedException when a reload is due; the session has been closed cleanly
     */
    public boolean run(String sessionId) {
        MdcContext.setSession(sessionId);
        try {
            startSession(sessionId);
            while (true) {
                Boolean exit = checkExit(sessionId);
                if (exit != null) {
                    return exit;
                }
                int iteration = store.incrementIteration();
                metrics.incrementIterations();
                applyCommands();

                List<String> pass = buildPass();
                if (pass.isEmpty()) {
                    idle(iteration);
                    continue;
                }
                log.info("Iteration {}: {} pending task(s)", iteration, pass.size());
                Boolean stopped = runPass(sessionId, pass);
                if (stopped != null) {
                    return stopped;
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void startSession(String sessionId) {
        RecoveryInfo recovery = store.getRecoveryInfo();
        store.markServerStart(sessionId);
        statusTrail.heading("Session " + sessionId, 2);
        if (!recovery.wasCleanShutdown()) {
            String current = recovery.currentTask() != null ? recovery.currentTask().text() : "none";
            log.warn("Previous run ended uncleanly (session {}): {} incomplete, {} failed, interrupted task: {}",
                    recovery.sessionId(), recovery.incompleteTasks().size(), recovery.failedTasks().size(), current);
            statusTrail.append("Recovered from unclean shutdown of " + recovery.sessionId()
                    + ". Incomplete: " + recovery.incompleteTasks().size()
                    + ", failed: " + recovery.failedTasks().size()
                    + ", interrupted: " + current);
        } else {
            log.info("Starting session {} (previous stop: {})", sessionId, recovery.stopReason());
            statusTrail.append("Session started");
        }
        syncTodoWithLedger();
        eventBus.publish(TaskPilotEvent.of("session.started", sessionId, null,
                Map.of("clean_previous_shutdown", recovery.wasCleanShutdown())));
    }

    /** TODO items the ledger already completed are ticked off in the source. */
    private void syncTodoWithLedger() {
        for (TodoItem item : todo.pendingItems()) {
            if (store.isTaskCompleted(item.text())) {
                log.info("Marking already completed task as done: {}", item.text());
                todo.markDone(item.text());
            }
        }
    }

    /**
     * @return null to keep going, otherwise the value {@link #run} returns
     */
    private Boolean checkExit(String sessionId) {
        LifecycleFlags.Snapshot snapshot = flags.snapshot();
        if (snapshot.shouldStop()) {
            boolean clean = !snapshot.stopCritical();
            store.markServerStop(clean, snapshot.stopReason());
            statusTrail.append("Session stopped: " + snapshot.stopReason());
            eventBus.publish(TaskPilotEvent.of("session.stopped", sessionId, null,
                    Map.of("clean", clean, "reason", String.valueOf(snapshot.stopReason()))));
            log.info("Stopping session {} (clean={}): {}", sessionId, clean, snapshot.stopReason());
            return clean;
        }
        if (snapshot.shouldReload() && !snapshot.taskInProgress()) {
            store.markServerStop(true, "reload");
            flags.completeReload();
            statusTrail.append("Reloading after source change");
            eventBus.publish(TaskPilotEvent.of("session.reload", sessionId, null, Map.of()));
            throw new ReloadRequestedException("reload requested during session " + sessionId);
        }
        return null;
    }

    private void applyCommands() {
        for (ControlCommand command : flags.drainCommands()) {
            if (command instanceof ControlCommand.AddTask add) {
                boolean known = todo.items().stream().anyMatch(i -> i.text().equals(add.text()));
                if (known) {
                    log.info("Task already listed, not adding again: {}", add.text());
                    continue;
                }
                if (add.atHead()) {
                    todo.insertAtHead(add.text());
                } else {
                    todo.insertAtTail(add.text());
                }
                statusTrail.append("Task added" + (add.atHead() ? " at head" : "") + ": " + add.text());
            } else if (command instanceof ControlCommand.ClearTasks) {
                int removed = todo.clearPending();
                statusTrail.append("Cleared " + removed + " pending task(s)");
                log.info("Cleared {} pending task(s)", removed);
            }
        }
    }

    private List<String> buildPass() {
        return todo.pendingItems().stream()
                .map(TodoItem::text)
                .filter(text -> !text.isBlank())
                .distinct()
                .toList();
    }

    private void idle(int iteration) {
        log.debug("Iteration {}: nothing to do, sleeping up to {}s", iteration, properties.getCheckInterval().toSeconds());
        try {
            flags.awaitChange(properties.getCheckInterval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flags.requestStop("loop interrupted", false);
        }
        todo.reload();
    }

    private Boolean runPass(String sessionId, List<String> pass) {
        Deque<String> queue = new ArrayDeque<>(pass);
        Set<String> postponed = new HashSet<>();
        while (!queue.isEmpty()) {
            Boolean exit = checkExit(sessionId);
            if (exit != null) {
                return exit;
            }
            if (flags.snapshot().pendingCommands() > 0) {
                // pick up added or cleared tasks on the next pass
                return null;
            }
            String text = queue.pollFirst();
            if (store.isTaskCompleted(text)) {
                todo.markDone(text);
                continue;
            }

            Optional<TaskRecord> existing = store.findActiveByText(text);
            if (existing.isPresent() && existing.get().instructionProgress() > 0
                    && !postponed.contains(text)
                    && advisor.advise(existing.get()) == ContinuationAdvisor.Advice.POSTPONE) {
                log.info("Postponing partially completed task to the end of the pass: {}", text);
                postponed.add(text);
                queue.addLast(text);
                continue;
            }

            TaskRecord started;
            try {
                started = store.startTask(existing.orElseGet(() -> TaskRecord.queued(TaskIds.nextTaskId(clock), text)));
            } catch (IllegalStateException e) {
                log.warn("Cannot start task '{}': {}", text, e.getMessage());
                continue;
            }
            TaskOutcome outcome = stateMachine.execute(started, sessionId);
            afterTask(started, outcome);

            if (!queue.isEmpty() && !properties.getTaskDelay().isZero()) {
                try {
                    flags.awaitStop(properties.getTaskDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    flags.requestStop("loop interrupted", false);
                }
            }
        }
        return null;
    }

    private void afterTask(TaskRecord started, TaskOutcome outcome) {
        switch (outcome.phase()) {
            case COMPLETED -> todo.markDone(started.text());
            case SKIPPED -> todo.markSkipped(started.text(), outcome.message());
            case FAILED -> {
                if (started.attempts() >= properties.getMaxTaskAttempts()) {
                    String reason = "failed after " + started.attempts() + " attempts: " + outcome.message();
                    log.warn("Giving up on task {}: {}", started.taskId(), reason);
                    todo.markSkipped(started.text(), reason);
                }
            }
            default -> log.debug("Task {} suspended, will resume next run", started.taskId());
        }
    }
}
