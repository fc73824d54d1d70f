package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One task entry in the checkpoint ledger.
 *
 * @param taskId              stable identifier, also used to derive artifact paths
 * @param text                task text as it appears in the TODO source
 * @param state               persisted lifecycle state
 * @param attempts            number of task-level attempts (instruction retries are not counted)
 * @param startTime           when the latest attempt started
 * @param endTime             when the task reached a terminal state
 * @param errorMessage        last failure or skip reason
 * @param instructionProgress number of instructions whose result was received
 * @param phase               last execution phase reached
 * @param category            instruction-template category chosen for the task
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskRecord(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("task_text") String text,
    @JsonProperty("state") TaskState state,
    @JsonProperty("attempts") int attempts,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("instruction_progress") int instructionProgress,
    @JsonProperty("phase") ExecutionPhase phase,
    @JsonProperty("category") String category
) {

    public static TaskRecord queued(String taskId, String text) {
        return new TaskRecord(taskId, text, TaskState.PENDING, 0, null, null, null, 0,
                ExecutionPhase.QUEUED, null);
    }

    public TaskRecord started(int attempts, Instant now) {
        return new TaskRecord(taskId, text, TaskState.IN_PROGRESS, attempts, now, null, null,
                instructionProgress, ExecutionPhase.QUEUED, category);
    }

    public TaskRecord finished(TaskState terminal, String error, Instant now) {
        ExecutionPhase last = switch (terminal) {
            case COMPLETED -> ExecutionPhase.COMPLETED;
            case SKIPPED -> ExecutionPhase.SKIPPED;
            default -> ExecutionPhase.FAILED;
        };
        return new TaskRecord(taskId, text, terminal, attempts, startTime, now, error,
                instructionProgress, last, category);
    }

    public TaskRecord progressed(ExecutionPhase newPhase, int progress, String newCategory) {
        return new TaskRecord(taskId, text, state, attempts, startTime, endTime, errorMessage,
                progress, newPhase, newCategory != null ? newCategory : category);
    }

    /** Back to pending after an interruption; {@code bumpAttempts} counts the lost attempt. */
    public TaskRecord requeued(boolean bumpAttempts) {
        return new TaskRecord(taskId, text, TaskState.PENDING, bumpAttempts ? attempts + 1 : attempts,
                startTime, null, errorMessage, instructionProgress, ExecutionPhase.QUEUED, category);
    }
}
