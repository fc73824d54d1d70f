package com.taskpilot.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs the agent as a local subprocess in the project directory.
 *
 * <p>Output is redirected to temp files rather than pipes so a chatty agent can never
 * block on a full pipe buffer.
 */
public class ProcessAgentProvider implements AgentProvider {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentProvider.class);

    private final List<String> command;
    private final List<String> probeCommand;
    private final List<String> clearSessionCommand;
    private final Duration probeTimeout;
    private final Path workDir;

    public ProcessAgentProvider(List<String> command, List<String> probeCommand, List<String> clearSessionCommand,
                                Duration probeTimeout, Path workDir) {
        this.command = List.copyOf(command);
        this.probeCommand = List.copyOf(probeCommand);
        this.clearSessionCommand = List.copyOf(clearSessionCommand);
        this.probeTimeout = probeTimeout;
        this.workDir = workDir;
    }

    @Override
    public String name() {
        return "process";
    }

    @Override
    public AgentExecution execute(AgentRequest request) {
        List<String> argv = CommandLineTemplate.expand(command, request, request.instructionFile());
        log.debug("Launching agent for task {}: {}", request.taskId(), argv.get(0));
        return run(argv, request.timeout());
    }

    @Override
    public boolean clearSession() {
        if (clearSessionCommand.isEmpty()) {
            return true;
        }
        try {
            return run(clearSessionCommand, probeTimeout).exitCode() == 0;
        } catch (AgentInvocationException e) {
            log.warn("Clearing agent session failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean probe() {
        if (probeCommand.isEmpty()) {
            return true;
        }
        try {
            AgentExecution result = run(probeCommand, probeTimeout);
            return result.exitCode() == 0;
        } catch (AgentInvocationException e) {
            log.warn("Agent probe failed: {}", e.getMessage());
            return false;
        }
    }

    AgentExecution run(List<String> argv, Duration timeout) {
        long start = System.currentTimeMillis();
        Path out = null;
        Path err = null;
        try {
            out = Files.createTempFile("taskpilot-agent-", ".out");
            err = Files.createTempFile("taskpilot-agent-", ".err");
            Process process = new ProcessBuilder(argv)
                    .directory(workDir.toFile())
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                    .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                // agents fork helpers; take the whole tree down
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                throw new AgentInvocationException("agent timed out after " + timeout.toSeconds() + "s");
            }
            return new AgentExecution(process.exitValue(),
                    Files.readString(out, StandardCharsets.UTF_8),
                    Files.readString(err, StandardCharsets.UTF_8),
                    System.currentTimeMillis() - start);
        } catch (IOException e) {
            throw new AgentInvocationException("cannot launch agent: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentInvocationException("interrupted while waiting for agent", e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
        return new File(windows ? "NUL" : "/dev/null");
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}", file);
        }
    }
}
