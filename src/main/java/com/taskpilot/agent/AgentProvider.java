package com.taskpilot.agent;

/**
 * Execution backend for the external agent.
 * Implementations: {@link ProcessAgentProvider} (local subprocess), {@link DockerAgentProvider} (container exec).
 */
public interface AgentProvider {

    String name();

    /**
     * Runs the agent to completion.
     *
     * @throws AgentInvocationException if the agent could not be started or timed out
     */
    AgentExecution execute(AgentRequest request);

    /**
     * Drops any conversation or session state the agent keeps between calls.
     *
     * @return false if the state could not be fully cleared
     */
    boolean clearSession();

    /**
     * @return true if the backend answers a trivial command
     */
    boolean probe();
}
