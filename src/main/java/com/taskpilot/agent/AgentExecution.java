package com.taskpilot.agent;

/**
 * Raw outcome of an agent process that ran to completion.
 */
public record AgentExecution(
    int exitCode,
    String stdout,
    String stderr,
    long elapsedMs
) {}
