package com.taskpilot.core.model;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of a result-artifact wait. A timeout is {@code success=false}, not an exception.
 */
public record ResultWaitOutcome(
    boolean success,
    String content,
    Path filePath,
    Duration waitTime
) {

    public static ResultWaitOutcome timedOut(Duration waited) {
        return new ResultWaitOutcome(false, null, null, waited);
    }
}
