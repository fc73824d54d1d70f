package com.taskpilot.core.model;

/**
 * How a single run of the state machine ended.
 *
 * @param phase   terminal phase, or {@link ExecutionPhase#QUEUED} when the task was suspended
 * @param message failure/skip reason, may be null
 */
public record TaskOutcome(String taskId, ExecutionPhase phase, String message) {

    public boolean suspended() {
        return phase == ExecutionPhase.QUEUED;
    }
}
