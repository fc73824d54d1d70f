package com.taskpilot.agent;

/**
 * What the caller should do after {@link AgentGateway#handleError(String)}.
 */
public enum ErrorDecision {
    CONTINUE,
    STOP
}
