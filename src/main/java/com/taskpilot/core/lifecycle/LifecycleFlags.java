package com.taskpilot.core.lifecycle;

import com.taskpilot.core.model.ControlCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Control-plane state shared by the orchestration loop, the control surface and the
 * source-change watcher.
 *
 * <p>All fields live behind one lock. Decisions are taken on a {@link Snapshot}, which
 * is read under the same lock used for writes. Every mutation signals {@link #awaitChange}
 * waiters so idle and backoff sleeps end as soon as something happens.
 */
@Component
public class LifecycleFlags {

    private static final Logger log = LoggerFactory.getLogger(LifecycleFlags.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private boolean shouldStop;
    private String stopReason;
    private boolean stopCritical;
    private boolean shouldReload;
    private boolean reloadAfterCurrentTask;
    private boolean taskInProgress;
    private int consecutiveIdleReloadSignals;
    private boolean skipCurrentRequested;
    private final Deque<ControlCommand> commands = new ArrayDeque<>();

    /**
     * Immutable view of the flags at one instant.
     */
    public record Snapshot(
        boolean shouldStop,
        String stopReason,
        boolean stopCritical,
        boolean shouldReload,
        boolean reloadAfterCurrentTask,
        boolean taskInProgress,
        int consecutiveIdleReloadSignals,
        boolean skipCurrentRequested,
        int pendingCommands
    ) {}

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(shouldStop, stopReason, stopCritical, shouldReload, reloadAfterCurrentTask,
                    taskInProgress, consecutiveIdleReloadSignals, skipCurrentRequested, commands.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests an orderly stop. The first reason wins; a later critical request still
     * upgrades the stop to critical.
     */
    public void requestStop(String reason, boolean critical) {
        lock.lock();
        try {
            if (!shouldStop) {
                stopReason = reason;
            }
            shouldStop = true;
            stopCritical = stopCritical || critical;
            log.info("Stop requested (critical={}): {}", critical, reason);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests a reload. With a task in flight the reload is deferred until that task
     * reaches a terminal state.
     */
    public void requestReload(String source) {
        lock.lock();
        try {
            if (taskInProgress) {
                reloadAfterCurrentTask = true;
                log.info("Reload requested by {} while a task is in progress, deferring", source);
            } else {
                shouldReload = true;
                consecutiveIdleReloadSignals++;
                log.info("Reload requested by {} (idle signal #{})", source, consecutiveIdleReloadSignals);
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the previous value, so nested holders can restore it
     */
    public boolean setTaskInProgress(boolean inProgress) {
        lock.lock();
        try {
            boolean previous = taskInProgress;
            taskInProgress = inProgress;
            if (!inProgress && skipCurrentRequested) {
                skipCurrentRequested = false;
                log.debug("Task finished before a pending skip request was applied, dropping it");
            }
            if (!inProgress && reloadAfterCurrentTask) {
                reloadAfterCurrentTask = false;
                shouldReload = true;
                log.info("Current task finished, deferred reload is now due");
            }
            changed.signalAll();
            return previous;
        } finally {
            lock.unlock();
        }
    }

    /** Clears the reload flags once the loop has acted on them. */
    public void completeReload() {
        lock.lock();
        try {
            shouldReload = false;
            reloadAfterCurrentTask = false;
            consecutiveIdleReloadSignals = 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asks the running task to end as skipped at its next phase boundary.
     *
     * @return false if no task is in progress; the request is then ignored
     */
    public boolean requestSkipCurrent() {
        lock.lock();
        try {
            if (!taskInProgress) {
                log.info("Skip requested with no task in progress, ignoring");
                return false;
            }
            skipCurrentRequested = true;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** @return true if a skip was pending; the request is cleared either way */
    public boolean consumeSkipRequest() {
        lock.lock();
        try {
            boolean requested = skipCurrentRequested;
            skipCurrentRequested = false;
            return requested;
        } finally {
            lock.unlock();
        }
    }

    public void enqueue(ControlCommand command) {
        lock.lock();
        try {
            commands.addLast(command);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public List<ControlCommand> drainCommands() {
        lock.lock();
        try {
            List<ControlCommand> drained = List.copyOf(commands);
            commands.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps up to {@code timeout}, returning early when a stop is requested.
     *
     * @return true if a stop is pending
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!shouldStop && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return shouldStop;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps up to {@code timeout}, returning early on any stop, reload, skip or queued command.
     *
     * @return true if woken by a change rather than the timeout
     */
    public boolean awaitChange(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            if (hasWork()) {
                return true;
            }
            long remaining = timeout.toNanos();
            while (!hasWork() && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return hasWork();
        } finally {
            lock.unlock();
        }
    }

    private boolean hasWork() {
        return shouldStop || shouldReload || skipCurrentRequested || !commands.isEmpty();
    }
}
