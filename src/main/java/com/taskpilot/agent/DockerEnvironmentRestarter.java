package com.taskpilot.agent;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotModifiedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Restarts the agent container: clear the agent session, stop and start the container,
 * wait until it answers, then make sure the agent executable is still installed.
 */
public class DockerEnvironmentRestarter implements EnvironmentRestarter {

    private static final Logger log = LoggerFactory.getLogger(DockerEnvironmentRestarter.class);

    private final DockerClient dockerClient;
    private final DockerAgentProvider provider;
    private final AgentProperties.Docker docker;
    private final Duration probeTimeout;

    public DockerEnvironmentRestarter(DockerClient dockerClient, DockerAgentProvider provider,
                                      AgentProperties.Docker docker, Duration probeTimeout) {
        this.dockerClient = dockerClient;
        this.provider = provider;
        this.docker = docker;
        this.probeTimeout = probeTimeout;
    }

    @Override
    public boolean restartEnvironment() {
        String container = docker.getContainerName();
        log.info("Restarting agent environment (container {})", container);
        try {
            log.info("Step 1: clearing agent session");
            if (!provider.clearSession()) {
                log.warn("Agent session could not be fully cleared");
            }

            log.info("Step 2: restarting container {}", container);
            try {
                dockerClient.stopContainerCmd(container).withTimeout(docker.getStopTimeoutSeconds()).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} was not running", container);
            }
            sleep(Duration.ofSeconds(2));
            dockerClient.startContainerCmd(container).exec();
            sleep(docker.getSettleDelay());

            log.info("Step 3: waiting for container {} to answer", container);
            if (!awaitReady()) {
                log.error("Container {} did not answer after {} probes", container, docker.getProbeAttempts());
                return false;
            }

            log.info("Step 4: checking agent executable {}", docker.getAgentPath());
            if (!agentInstalled()) {
                log.warn("Agent executable missing, re-provisioning");
                AgentExecution reinstall = provider.exec(
                        List.of("bash", "-c", docker.getReprovisionCommand()), Duration.ofSeconds(120));
                if (reinstall.exitCode() != 0) {
                    log.error("Re-provisioning agent failed: {}", abbreviate(reinstall.stderr()));
                    return false;
                }
                if (!agentInstalled()) {
                    log.error("Agent executable still missing after re-provisioning");
                    return false;
                }
                log.info("Agent re-provisioned");
            }

            boolean ready = provider.probe();
            log.info("Agent environment restart {}", ready ? "succeeded" : "failed");
            return ready;
        } catch (DockerException | AgentInvocationException e) {
            log.error("Agent environment restart failed: {}", e.getMessage(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Agent environment restart interrupted");
            return false;
        }
    }

    private boolean awaitReady() throws InterruptedException {
        for (int attempt = 1; attempt <= docker.getProbeAttempts(); attempt++) {
            try {
                if (provider.exec(List.of("echo", "ok"), probeTimeout).exitCode() == 0) {
                    log.debug("Container answered on probe {}", attempt);
                    return true;
                }
            } catch (AgentInvocationException e) {
                log.debug("Probe {} failed: {}", attempt, e.getMessage());
            }
            sleep(docker.getProbeInterval());
        }
        return false;
    }

    private boolean agentInstalled() {
        try {
            return provider.exec(List.of(docker.getAgentPath(), "--version"), probeTimeout).exitCode() == 0;
        } catch (AgentInvocationException e) {
            log.debug("Agent version check failed: {}", e.getMessage());
            return false;
        }
    }

    private static void sleep(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    }

    private static String abbreviate(String text) {
        return text == null || text.length() <= 200 ? text : text.substring(0, 200);
    }
}
