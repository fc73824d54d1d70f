package com.taskpilot.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "taskpilot.agent")
public class AgentProperties {

    /** {@code process} runs the command locally, {@code docker} runs it inside a long-lived container. */
    private String provider = "process";

    /**
     * Agent command line. Placeholders: {instruction}, {instruction_file}, {task_id}.
     */
    private List<String> command = new ArrayList<>(List.of("agent", "-p", "{instruction}"));

    /** Command whose success proves the backend answers. */
    private List<String> probeCommand = new ArrayList<>(List.of("agent", "--version"));

    /** Command that drops agent conversation state; empty when the agent keeps none. */
    private List<String> clearSessionCommand = new ArrayList<>();

    private Duration timeout = Duration.ofMinutes(10);
    private Duration probeTimeout = Duration.ofSeconds(10);

    private Docker docker = new Docker();
    private Retry retry = new Retry();

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public List<String> getProbeCommand() { return probeCommand; }
    public void setProbeCommand(List<String> probeCommand) { this.probeCommand = probeCommand; }
    public List<String> getClearSessionCommand() { return clearSessionCommand; }
    public void setClearSessionCommand(List<String> clearSessionCommand) { this.clearSessionCommand = clearSessionCommand; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public static class Docker {
        private String containerName = "taskpilot-agent";
        private String workspace = "/workspace";
        private String agentPath = "/root/.local/bin/agent";
        private String reprovisionCommand = "curl https://cursor.com/install -fsS | bash";
        private int stopTimeoutSeconds = 15;
        private int probeAttempts = 10;
        private Duration probeInterval = Duration.ofSeconds(2);
        private Duration settleDelay = Duration.ofSeconds(5);

        public String getContainerName() { return containerName; }
        public void setContainerName(String containerName) { this.containerName = containerName; }
        public String getWorkspace() { return workspace; }
        public void setWorkspace(String workspace) { this.workspace = workspace; }
        public String getAgentPath() { return agentPath; }
        public void setAgentPath(String agentPath) { this.agentPath = agentPath; }
        public String getReprovisionCommand() { return reprovisionCommand; }
        public void setReprovisionCommand(String reprovisionCommand) { this.reprovisionCommand = reprovisionCommand; }
        public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
        public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
        public int getProbeAttempts() { return probeAttempts; }
        public void setProbeAttempts(int probeAttempts) { this.probeAttempts = probeAttempts; }
        public Duration getProbeInterval() { return probeInterval; }
        public void setProbeInterval(Duration probeInterval) { this.probeInterval = probeInterval; }
        public Duration getSettleDelay() { return settleDelay; }
        public void setSettleDelay(Duration settleDelay) { this.settleDelay = settleDelay; }
    }

    public static class Retry {
        private Duration initialDelay = Duration.ofSeconds(30);
        private Duration delayIncrement = Duration.ofSeconds(30);
        private int maxConsecutiveErrors = 3;
        private int maxRestartAttempts = 3;
        private int maxInstructionRetries = 10;
        private int signatureLength = 100;

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getDelayIncrement() { return delayIncrement; }
        public void setDelayIncrement(Duration delayIncrement) { this.delayIncrement = delayIncrement; }
        public int getMaxConsecutiveErrors() { return maxConsecutiveErrors; }
        public void setMaxConsecutiveErrors(int maxConsecutiveErrors) { this.maxConsecutiveErrors = maxConsecutiveErrors; }
        public int getMaxRestartAttempts() { return maxRestartAttempts; }
        public void setMaxRestartAttempts(int maxRestartAttempts) { this.maxRestartAttempts = maxRestartAttempts; }
        public int getMaxInstructionRetries() { return maxInstructionRetries; }
        public void setMaxInstructionRetries(int maxInstructionRetries) { this.maxInstructionRetries = maxInstructionRetries; }
        public int getSignatureLength() { return signatureLength; }
        public void setSignatureLength(int signatureLength) { this.signatureLength = signatureLength; }
    }
}
