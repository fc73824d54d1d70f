package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * What the previous run left behind, as seen when the ledger was opened.
 *
 * @param currentTask the task that was {@code in_progress} when the previous run died, or null
 */
public record RecoveryInfo(
    @JsonProperty("was_clean_shutdown") boolean wasCleanShutdown,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("last_start_time") Instant lastStartTime,
    @JsonProperty("last_stop_time") Instant lastStopTime,
    @JsonProperty("stop_reason") String stopReason,
    @JsonProperty("iteration_count") int iterationCount,
    @JsonProperty("incomplete_tasks") List<TaskRecord> incompleteTasks,
    @JsonProperty("failed_tasks") List<TaskRecord> failedTasks,
    @JsonProperty("current_task") TaskRecord currentTask
) {}
