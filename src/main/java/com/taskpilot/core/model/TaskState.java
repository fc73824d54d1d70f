package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Persisted lifecycle state of a task in the checkpoint ledger.
 */
public enum TaskState {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    TaskState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
