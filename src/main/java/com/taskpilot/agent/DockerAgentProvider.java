package com.taskpilot.agent;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the agent with {@code docker exec} inside a long-lived container.
 *
 * <p>The container bind-mounts the project directory at {@code workspace}; instruction
 * file paths are translated from the host project dir to that mount.
 *
 * <p>An agent run is wrapped in the container's {@code timeout} so it is killed in place
 * when it overruns. If the exec is still attached {@code stopTimeoutSeconds} after that,
 * the container is stopped and started again, which ends every exec inside it.
 */
public class DockerAgentProvider implements AgentProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerAgentProvider.class);

    private final DockerClient dockerClient;
    private final String containerName;
    private final String workspace;
    private final Path projectDir;
    private final List<String> command;
    private final List<String> probeCommand;
    private final List<String> clearSessionCommand;
    private final Duration probeTimeout;
    private final int stopTimeoutSeconds;

    public DockerAgentProvider(DockerClient dockerClient, String containerName, String workspace, Path projectDir,
                               List<String> command, List<String> probeCommand, List<String> clearSessionCommand,
                               Duration probeTimeout, int stopTimeoutSeconds) {
        this.dockerClient = dockerClient;
        this.containerName = containerName;
        this.workspace = workspace;
        this.projectDir = projectDir;
        this.command = List.copyOf(command);
        this.probeCommand = List.copyOf(probeCommand);
        this.clearSessionCommand = List.copyOf(clearSessionCommand);
        this.probeTimeout = probeTimeout;
        this.stopTimeoutSeconds = stopTimeoutSeconds;
    }

    @Override
    public String name() {
        return "docker";
    }

    public String containerName() {
        return containerName;
    }

    @Override
    public AgentExecution execute(AgentRequest request) {
        Path inContainer = toContainerPath(request.instructionFile());
        List<String> argv = CommandLineTemplate.expand(command, request, inContainer);
        log.debug("Executing agent in container {} for task {}", containerName, request.taskId());
        return run(withTimeout(argv, request.timeout(), stopTimeoutSeconds),
                request.timeout().plusSeconds(stopTimeoutSeconds), true);
    }

    /** Prefixes {@code timeout -k <grace>s <secs>s}, rounding the limit up to whole seconds. */
    static List<String> withTimeout(List<String> argv, Duration timeout, int graceSeconds) {
        long seconds = Math.max(1, (timeout.toMillis() + 999) / 1000);
        var wrapped = new ArrayList<String>(List.of("timeout", "-k", graceSeconds + "s", seconds + "s"));
        wrapped.addAll(argv);
        return wrapped;
    }

    @Override
    public boolean clearSession() {
        if (clearSessionCommand.isEmpty()) {
            return true;
        }
        try {
            return exec(clearSessionCommand, probeTimeout).exitCode() == 0;
        } catch (AgentInvocationException e) {
            log.warn("Clearing agent session in {} failed: {}", containerName, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean probe() {
        try {
            List<String> argv = probeCommand.isEmpty() ? List.of("echo", "ok") : probeCommand;
            return exec(argv, probeTimeout).exitCode() == 0;
        } catch (AgentInvocationException e) {
            log.debug("Container {} probe failed: {}", containerName, e.getMessage());
            return false;
        }
    }

    /**
     * Runs a command in the container and waits for it.
     *
     * @throws AgentInvocationException if the exec cannot be created or does not finish in time
     */
    public AgentExecution exec(List<String> argv, Duration timeout) {
        return run(argv, timeout, false);
    }

    private AgentExecution run(List<String> argv, Duration timeout, boolean recycleOnTimeout) {
        long start = System.currentTimeMillis();
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        try {
            var created = dockerClient.execCreateCmd(containerName)
                    .withCmd(argv.toArray(new String[0]))
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withWorkingDir(workspace)
                    .exec();

            boolean finished;
            try (var callback = dockerClient.execStartCmd(created.getId())
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            String text = new String(frame.getPayload(), StandardCharsets.UTF_8);
                            if (frame.getStreamType() == StreamType.STDERR) {
                                stderr.append(text);
                            } else {
                                stdout.append(text);
                            }
                        }
                    })) {
                finished = callback.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                if (recycleOnTimeout) {
                    recycleContainer();
                }
                throw new AgentInvocationException("agent timed out after " + timeout.toSeconds()
                        + "s in container " + containerName);
            }
            Long exitCode = dockerClient.inspectExecCmd(created.getId()).exec().getExitCodeLong();
            return new AgentExecution(exitCode != null ? exitCode.intValue() : -1,
                    stdout.toString(), stderr.toString(), System.currentTimeMillis() - start);
        } catch (DockerException e) {
            throw new AgentInvocationException("docker exec in " + containerName + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AgentInvocationException("docker exec stream error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentInvocationException("interrupted while waiting for docker exec", e);
        }
    }

    private void recycleContainer() {
        log.warn("Agent exec in {} outlived its timeout, restarting the container to end it", containerName);
        try {
            dockerClient.stopContainerCmd(containerName).withTimeout(stopTimeoutSeconds).exec();
            dockerClient.startContainerCmd(containerName).exec();
        } catch (DockerException e) {
            log.error("Restarting container {} after a timed-out exec failed: {}", containerName, e.getMessage());
        }
    }

    Path toContainerPath(Path hostFile) {
        if (hostFile == null) {
            return null;
        }
        Path abs = hostFile.toAbsolutePath().normalize();
        if (!abs.startsWith(projectDir)) {
            return abs;
        }
        return Path.of(workspace).resolve(projectDir.relativize(abs));
    }
}
