package com.taskpilot.agent;

/**
 * Restarts the agent's execution backend without touching orchestrator state.
 * Called only from {@link AgentGateway}'s serialized error path.
 */
public interface EnvironmentRestarter {

    /**
     * @return true only if the backend answers after the restart
     */
    boolean restartEnvironment();
}
