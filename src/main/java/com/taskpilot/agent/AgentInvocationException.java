package com.taskpilot.agent;

/**
 * The agent could not be run or did not finish: launch failure, transport error or timeout.
 * {@link AgentGateway} turns it into a failed {@link com.taskpilot.core.model.InvocationResult}.
 */
public class AgentInvocationException extends RuntimeException {

    public AgentInvocationException(String message) {
        super(message);
    }

    public AgentInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
