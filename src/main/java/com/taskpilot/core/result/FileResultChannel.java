package com.taskpilot.core.result;

import com.taskpilot.core.lifecycle.LifecycleFlags;
import com.taskpilot.core.model.ResultWaitOutcome;
import com.taskpilot.core.model.ResultWaitRequest;
import com.taskpilot.core.todo.ProjectProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link ResultChannel} over plain files, polled at a fixed interval.
 *
 * <p>A wait marks a task as in progress for its whole duration and is deliberately
 * not interruptible by a stop request: an agent that is still writing its result is
 * never abandoned halfway. Only the timeout ends it early.
 */
@Component
public class FileResultChannel implements ResultChannel {

    private static final Logger log = LoggerFactory.getLogger(FileResultChannel.class);

    private final Path artifactsDir;
    private final Duration pollInterval;
    private final List<String> fallbackPatterns;
    private final LifecycleFlags flags;

    public FileResultChannel(Path artifactsDir, Duration pollInterval, List<String> fallbackPatterns,
                             LifecycleFlags flags) {
        this.artifactsDir = artifactsDir;
        this.pollInterval = pollInterval;
        this.fallbackPatterns = List.copyOf(fallbackPatterns);
        this.flags = flags;
    }

    @Autowired
    public FileResultChannel(ProjectProperties project, ResultProperties properties, LifecycleFlags flags) {
        this(project.artifactsPath(), properties.getPollInterval(), properties.getFallbackPatterns(), flags);
    }

    public Path artifactsDir() {
        return artifactsDir;
    }

    @Override
    public Path publishInstruction(String taskId, int instructionNumber, String text) {
        Path target = artifactsDir.resolve("instruction_" + taskId + "_" + instructionNumber + ".md");
        try {
            Files.createDirectories(artifactsDir);
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write instruction artifact " + target, e);
        }
        log.debug("Instruction {} for task {} written to {}", instructionNumber, taskId, target);
        return target;
    }

    @Override
    public ResultWaitOutcome await(ResultWaitRequest request) {
        List<Path> candidates = candidates(request);
        for (Path candidate : candidates) {
            try {
                Path parent = candidate.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                log.warn("Cannot create directory for result candidate {}: {}", candidate, e.getMessage());
            }
        }

        log.info("Waiting up to {}s for result of task {} (phrase: {}) in {}",
                request.timeout().toSeconds(), request.taskId(), request.controlPhrase(), candidates);

        boolean previous = flags.setTaskInProgress(true);
        long start = System.nanoTime();
        long deadline = start + request.timeout().toNanos();
        try {
            while (true) {
                for (Path candidate : candidates) {
                    String content = readIfComplete(candidate, request.controlPhrase());
                    if (content != null) {
                        Duration waited = Duration.ofNanos(System.nanoTime() - start);
                        log.info("Result for task {} found in {} after {} ms", request.taskId(), candidate,
                                waited.toMillis());
                        return new ResultWaitOutcome(true, content, candidate, waited);
                    }
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                try {
                    Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Result wait for task {} interrupted", request.taskId());
                    break;
                }
            }
        } finally {
            flags.setTaskInProgress(previous);
        }

        Duration waited = Duration.ofNanos(System.nanoTime() - start);
        log.warn("No complete result for task {} within {}s", request.taskId(), request.timeout().toSeconds());
        return ResultWaitOutcome.timedOut(waited);
    }

    /**
     * Primary candidates first, then the fallback names in each candidate's directory.
     */
    List<Path> candidates(ResultWaitRequest request) {
        Set<Path> all = new LinkedHashSet<>(request.candidatePaths());
        for (Path candidate : request.candidatePaths()) {
            Path dir = candidate.toAbsolutePath().getParent();
            if (dir == null) {
                continue;
            }
            for (String pattern : fallbackPatterns) {
                all.add(dir.resolve(pattern.replace("{task_id}", request.taskId())));
            }
        }
        return new ArrayList<>(all);
    }

    private String readIfComplete(Path candidate, String controlPhrase) {
        if (!Files.isRegularFile(candidate)) {
            return null;
        }
        try {
            String content = Files.readString(candidate, StandardCharsets.UTF_8);
            if (controlPhrase == null || controlPhrase.isEmpty() || content.contains(controlPhrase)) {
                return content;
            }
            return null;
        } catch (IOException e) {
            // Agent may be mid-write; the next poll retries.
            log.debug("Cannot read result candidate {} yet: {}", candidate, e.getMessage());
            return null;
        }
    }
}
