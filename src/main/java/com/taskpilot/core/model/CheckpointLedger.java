package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Durable snapshot of session and task state. Always written as a whole.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckpointLedger(
    @JsonProperty("version") String version,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("last_start_time") Instant lastStartTime,
    @JsonProperty("last_stop_time") Instant lastStopTime,
    @JsonProperty("clean_shutdown") boolean cleanShutdown,
    @JsonProperty("stop_reason") String stopReason,
    @JsonProperty("iteration_count") int iterationCount,
    @JsonProperty("tasks") List<TaskRecord> tasks
) {

    public static final String CURRENT_VERSION = "1.0";

    public CheckpointLedger {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    /** A fresh ledger counts as cleanly shut down: there is nothing to recover. */
    public static CheckpointLedger empty() {
        return new CheckpointLedger(CURRENT_VERSION, null, null, null, true, null, 0, List.of());
    }

    public CheckpointLedger withTasks(List<TaskRecord> newTasks) {
        return new CheckpointLedger(version, sessionId, lastStartTime, lastStopTime, cleanShutdown,
                stopReason, iterationCount, newTasks);
    }

    public CheckpointLedger withSessionStart(String newSessionId, Instant now) {
        return new CheckpointLedger(version, newSessionId, now, lastStopTime, false, null,
                iterationCount, tasks);
    }

    public CheckpointLedger withSessionStop(boolean clean, String reason, Instant now) {
        return new CheckpointLedger(version, sessionId, lastStartTime, now, clean, reason,
                iterationCount, tasks);
    }

    public CheckpointLedger withIterationCount(int count) {
        return new CheckpointLedger(version, sessionId, lastStartTime, lastStopTime, cleanShutdown,
                stopReason, count, tasks);
    }
}
