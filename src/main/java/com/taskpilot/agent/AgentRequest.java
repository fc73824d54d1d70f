package com.taskpilot.agent;

import java.nio.file.Path;
import java.time.Duration;

/**
 * One call to the external agent.
 *
 * @param instructionFile where the instruction was published, may be null
 */
public record AgentRequest(
    String taskId,
    String instruction,
    Path instructionFile,
    Duration timeout
) {}
