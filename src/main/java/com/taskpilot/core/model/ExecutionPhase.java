package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fine-grained phase of a task while the state machine drives it.
 * The instruction-indexed phases carry their index in {@link TaskRecord#instructionProgress()}.
 */
public enum ExecutionPhase {
    QUEUED("queued"),
    ANALYZING("analyzing"),
    INSTRUCTING("instructing"),
    EXECUTING("executing"),
    AWAITING_RESULT("awaiting_result"),
    VERIFYING("verifying"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    ExecutionPhase(String value) {
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
