package com.taskpilot.agent;

import com.taskpilot.core.classifier.FailureClassifier;
import com.taskpilot.core.lifecycle.LifecycleFlags;
import com.taskpilot.core.metrics.TaskPilotMetrics;
import com.taskpilot.core.model.ErrorCategory;
import com.taskpilot.core.model.InvocationResult;
import com.taskpilot.core.status.StatusTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point to the external agent.
 *
 * <p>{@link #invoke} never throws: launch failures and timeouts come back as failed
 * {@link InvocationResult}s. After a failure the caller asks {@link #handleError} what to do;
 * that path classifies the error, tracks the error streak, restarts the environment when
 * warranted and applies the backoff delay.
 *
 * <p>Invocations and restarts share one lock, so a restart never overlaps an agent call.
 * The backoff sleep happens outside the lock and ends early on a stop request.
 */
@Service
public class AgentGateway {

    private static final Logger log = LoggerFactory.getLogger(AgentGateway.class);

    private final AgentProvider provider;
    private final EnvironmentRestarter restarter;
    private final FailureClassifier classifier;
    private final LifecycleFlags flags;
    private final StatusTrail statusTrail;
    private final TaskPilotMetrics metrics;
    private final AgentProperties.Retry retry;

    private final ReentrantLock serial = new ReentrantLock();
    private final ErrorStreak streak;
    private int failedRestarts;

    public AgentGateway(AgentProvider provider, EnvironmentRestarter restarter, FailureClassifier classifier,
                        LifecycleFlags flags, StatusTrail statusTrail, TaskPilotMetrics metrics,
                        AgentProperties properties) {
        this.provider = provider;
        this.restarter = restarter;
        this.classifier = classifier;
        this.flags = flags;
        this.statusTrail = statusTrail;
        this.metrics = metrics;
        this.retry = properties.getRetry();
        this.streak = new ErrorStreak(retry.getSignatureLength(), retry.getInitialDelay(), retry.getDelayIncrement());
    }

    public InvocationResult invoke(String instruction, String taskId, Duration timeout) {
        return invoke(new AgentRequest(taskId, instruction, null, timeout));
    }

    public InvocationResult invoke(String instruction, Path instructionFile, String taskId, Duration timeout) {
        return invoke(new AgentRequest(taskId, instruction, instructionFile, timeout));
    }

    private InvocationResult invoke(AgentRequest request) {
        long start = System.currentTimeMillis();
        serial.lock();
        InvocationResult result;
        try {
            AgentExecution execution = provider.execute(request);
            if (execution.exitCode() == 0) {
                result = new InvocationResult(true, execution.stdout(), execution.stderr(), 0, null,
                        execution.elapsedMs());
            } else {
                String detail = firstNonBlank(execution.stderr(), execution.stdout());
                String message = "agent exited with code " + execution.exitCode()
                        + (detail.isEmpty() ? "" : ": " + abbreviate(detail, 500));
                result = new InvocationResult(false, execution.stdout(), execution.stderr(), execution.exitCode(),
                        message, execution.elapsedMs());
            }
        } catch (AgentInvocationException e) {
            result = InvocationResult.failure(e.getMessage(), System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.error("Unexpected failure invoking agent for task {}", request.taskId(), e);
            result = InvocationResult.failure("unknown error: " + e.getMessage(), System.currentTimeMillis() - start);
        } finally {
            serial.unlock();
        }
        metrics.recordInvocation(result.success(), result.elapsedMs());
        if (result.success()) {
            log.info("Agent finished task {} in {} ms", request.taskId(), result.elapsedMs());
        } else {
            log.warn("Agent call for task {} failed after {} ms: {}", request.taskId(), result.elapsedMs(),
                    result.errorMessage());
        }
        return result;
    }

    /**
     * Decides how to proceed after a failed invocation.
     *
     * <p>Precedence: a critical error stops at once; an exhausted restart budget stops
     * next; a recoverable error early in its streak gets a restart; a streak at the
     * consecutive-error threshold gets a restart that must succeed; anything else
     * backs off and continues.
     */
    public ErrorDecision handleError(String errorMessage) {
        ErrorCategory category = classifier.classify(errorMessage);
        metrics.recordAgentError(category);

        Duration delay;
        serial.lock();
        try {
            streak.record(errorMessage);
            int count = streak.count();
            log.info("Handling agent error #{} ({}): {}", count, category, errorMessage);

            if (category == ErrorCategory.CRITICAL) {
                log.error("Critical agent error, restart cannot fix it: {}", errorMessage);
                return stop("Critical agent error: " + errorMessage);
            }

            if (failedRestarts >= retry.getMaxRestartAttempts()
                    && (category == ErrorCategory.RECOVERABLE || count >= retry.getMaxConsecutiveErrors())) {
                return stop("Environment restart attempts exhausted (" + failedRestarts + "): " + errorMessage);
            }

            if (category == ErrorCategory.RECOVERABLE && count <= 2) {
                log.warn("Recoverable agent error #{}, restarting environment", count);
                if (restart("recoverable error: " + errorMessage)) {
                    return ErrorDecision.CONTINUE;
                }
                if (failedRestarts >= retry.getMaxRestartAttempts()) {
                    return stop("Environment restart attempts exhausted (" + failedRestarts + "): " + errorMessage);
                }
                log.warn("Environment restart failed, falling back to backoff");
            }

            if (count >= retry.getMaxConsecutiveErrors()) {
                log.error("Agent error repeated {} times, restarting environment", count);
                statusTrail.append("Agent error repeated " + count + " times: " + errorMessage);
                if (restart("repeated error: " + errorMessage)) {
                    return ErrorDecision.CONTINUE;
                }
                return stop("Environment restart failed after " + count + " repeated errors: " + errorMessage);
            }

            delay = streak.delay();
        } finally {
            serial.unlock();
        }

        log.warn("Backing off {}s before the next agent call", delay.toSeconds());
        metrics.recordBackoff(delay);
        try {
            if (flags.awaitStop(delay)) {
                log.info("Backoff cut short by stop request");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Backoff interrupted");
        }
        return ErrorDecision.CONTINUE;
    }

    /** Resets the error streak and the failed-restart budget after a successful call. */
    public void recordSuccess() {
        serial.lock();
        try {
            if (streak.count() > 0 || failedRestarts > 0) {
                log.debug("Agent call succeeded, resetting error streak");
            }
            streak.reset();
            failedRestarts = 0;
        } finally {
            serial.unlock();
        }
    }

    public int maxInstructionRetries() {
        return retry.getMaxInstructionRetries();
    }

    // Snapshot accessors for status reporting and tests.

    public int streakCount() {
        serial.lock();
        try {
            return streak.count();
        } finally {
            serial.unlock();
        }
    }

    public Duration currentDelay() {
        serial.lock();
        try {
            return streak.delay();
        } finally {
            serial.unlock();
        }
    }

    public int failedRestarts() {
        serial.lock();
        try {
            return failedRestarts;
        } finally {
            serial.unlock();
        }
    }

    private boolean restart(String why) {
        boolean ok;
        try {
            ok = restarter.restartEnvironment();
        } catch (RuntimeException e) {
            log.error("Environment restart threw", e);
            ok = false;
        }
        metrics.recordEnvironmentRestart(ok);
        if (ok) {
            statusTrail.append("Agent environment restarted (" + why + ")");
            streak.reset();
            failedRestarts = 0;
        } else {
            failedRestarts++;
            statusTrail.append("Agent environment restart failed (" + failedRestarts + "/"
                    + retry.getMaxRestartAttempts() + "): " + why);
        }
        return ok;
    }

    private ErrorDecision stop(String reason) {
        flags.requestStop(reason, true);
        statusTrail.append("**Stopping:** " + reason);
        return ErrorDecision.STOP;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.strip();
        }
        return b == null ? "" : b.strip();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
