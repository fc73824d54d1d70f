package com.taskpilot.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Parameters of one result-artifact wait. Not persisted.
 *
 * @param candidatePaths primary artifact path first; the channel may add fallbacks
 * @param controlPhrase  phrase the artifact must contain, or null to accept any existing file
 */
public record ResultWaitRequest(
    String taskId,
    List<Path> candidatePaths,
    String controlPhrase,
    Duration timeout
) {

    public ResultWaitRequest {
        candidatePaths = List.copyOf(candidatePaths);
    }
}
