package com.taskpilot.core.model;

import java.time.Duration;

/**
 * One step of a task's instruction sequence.
 *
 * @param instructionId 1-based position in the sequence
 * @param name          short label used in logs
 * @param template      instruction text with {@code {placeholder}} markers
 * @param waitForFile   result artifact path relative to the project dir, or null for no handshake
 * @param controlPhrase marker the agent writes when the artifact is complete, or null
 * @param timeout       per-step result timeout, or null for the channel default
 */
public record InstructionTemplate(
    int instructionId,
    String name,
    String template,
    String waitForFile,
    String controlPhrase,
    Duration timeout
) {

    public boolean expectsResult() {
        return waitForFile != null && !waitForFile.isBlank();
    }
}
