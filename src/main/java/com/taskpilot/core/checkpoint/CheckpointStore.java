package com.taskpilot.core.checkpoint;

import com.taskpilot.core.model.CheckpointLedger;
import com.taskpilot.core.model.ExecutionPhase;
import com.taskpilot.core.model.RecoveryInfo;
import com.taskpilot.core.model.TaskRecord;
import com.taskpilot.core.model.TaskState;

import java.util.List;
import java.util.Optional;

/**
 * Crash-safe ledger of task and session state.
 *
 * <p>Every mutating call is durable when it returns: the whole ledger has been written
 * and atomically swapped into place. A failed write surfaces as {@link CheckpointWriteException}.
 */
public interface CheckpointStore {

    /**
     * Marks a task in progress, creating its record if the text is new.
     *
     * @return the record as persisted
     * @throws IllegalStateException if the task is already in progress or completed
     */
    TaskRecord startTask(TaskRecord record);

    void endTask(String taskId, boolean success, String errorMessage);

    default void endTask(String taskId, boolean success) {
        endTask(taskId, success, null);
    }

    /** Records a skip, creating the record if the task never started. */
    void skipTask(String taskId, String text, String reason);

    /** Returns an in-progress task to pending without counting an extra attempt. */
    void suspendTask(String taskId);

    void recordProgress(String taskId, ExecutionPhase phase, int instructionProgress, String category);

    void markServerStart(String sessionId);

    void markServerStop(boolean clean, String reason);

    default void markServerStop(boolean clean) {
        markServerStop(clean, null);
    }

    int incrementIteration();

    boolean isTaskCompleted(String text);

    /** The non-completed record for a text, if one exists. */
    Optional<TaskRecord> findActiveByText(String text);

    Optional<TaskRecord> getTask(String taskId);

    List<TaskRecord> getTasks();

    List<TaskRecord> getCompletedTasks();

    RecoveryInfo getRecoveryInfo();

    Statistics getStatistics();

    record Statistics(
        int total,
        int pending,
        int inProgress,
        int completed,
        int failed,
        int skipped,
        int iterationCount
    ) {

        public static Statistics of(CheckpointLedger ledger) {
            int[] counts = new int[TaskState.values().length];
            for (TaskRecord task : ledger.tasks()) {
                counts[task.state().ordinal()]++;
            }
            return new Statistics(ledger.tasks().size(),
                    counts[TaskState.PENDING.ordinal()],
                    counts[TaskState.IN_PROGRESS.ordinal()],
                    counts[TaskState.COMPLETED.ordinal()],
                    counts[TaskState.FAILED.ordinal()],
                    counts[TaskState.SKIPPED.ordinal()],
                    ledger.iterationCount());
        }
    }
}
