package com.taskpilot.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restart for a local agent: there is no backend to bounce, so clear the session and
 * check the executable still answers.
 */
public class LocalEnvironmentRestarter implements EnvironmentRestarter {

    private static final Logger log = LoggerFactory.getLogger(LocalEnvironmentRestarter.class);

    private final AgentProvider provider;

    public LocalEnvironmentRestarter(AgentProvider provider) {
        this.provider = provider;
    }

    @Override
    public boolean restartEnvironment() {
        log.info("Restarting local agent environment");
        if (!provider.clearSession()) {
            log.warn("Agent session could not be fully cleared");
        }
        boolean ready = provider.probe();
        if (ready) {
            log.info("Local agent answers after restart");
        } else {
            log.error("Local agent does not answer after restart");
        }
        return ready;
    }
}
