package com.taskpilot.core.instruction;

import java.time.Duration;

/**
 * An instruction with every placeholder substituted, ready to hand to the agent.
 *
 * @param waitForFile   result artifact path relative to the project dir, or null
 * @param controlPhrase completion marker, or null
 * @param timeout       result timeout, or null for the channel default
 */
public record PreparedInstruction(
    int number,
    String name,
    String text,
    String waitForFile,
    String controlPhrase,
    Duration timeout
) {

    public boolean expectsResult() {
        return waitForFile != null && !waitForFile.isBlank();
    }
}
