package com.taskpilot.core.engine;

import com.taskpilot.agent.AgentGateway;
import com.taskpilot.agent.AgentProperties;
import com.taskpilot.agent.ErrorDecision;
import com.taskpilot.core.checkpoint.CheckpointStore;
import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.events.TaskPilotEvent;
import com.taskpilot.core.instruction.InstructionBuilder;
import com.taskpilot.core.instruction.InstructionCatalog;
import com.taskpilot.core.instruction.PreparedInstruction;
import com.taskpilot.core.instruction.TaskClassifier;
import com.taskpilot.core.lifecycle.LifecycleFlags;
import com.taskpilot.core.logging.MdcContext;
import com.taskpilot.core.metrics.TaskPilotMetrics;
import com.taskpilot.core.model.ExecutionPhase;
import com.taskpilot.core.model.InstructionTemplate;
import com.taskpilot.core.model.InvocationResult;
import com.taskpilot.core.model.ResultWaitOutcome;
import com.taskpilot.core.model.ResultWaitRequest;
import com.taskpilot.core.model.TaskOutcome;
import com.taskpilot.core.model.TaskRecord;
import com.taskpilot.core.model.Verdict;
import com.taskpilot.core.result.ResultChannel;
import com.taskpilot.core.result.ResultProperties;
import com.taskpilot.core.status.StatusTrail;
import com.taskpilot.core.todo.ProjectProperties;
import com.taskpilot.core.verification.ResultVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one started task through its phases:
 * {@code queued -> analyzing -> instructing(n) -> executing(n) -> awaiting_result(n) -> verifying},
 * ending {@code completed}, {@code failed} or {@code skipped}.
 *
 * <p>Every phase change is written to the checkpoint before the next step depends on it,
 * and published on the {@link EventBus}. Stop and skip requests are honoured only at phase
 * boundaries: a stop between instructions suspends the task with its progress kept, so the
 * next run resumes from the following instruction.
 */
@Component
public class TaskStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskStateMachine.class);

    private final CheckpointStore store;
    private final AgentGateway gateway;
    private final ResultChannel resultChannel;
    private final InstructionCatalog catalog;
    private final InstructionBuilder builder;
    private final TaskClassifier classifier;
    private final ResultVerifier verifier;
    private final LifecycleFlags flags;
    private final EventBus eventBus;
    private final StatusTrail statusTrail;
    private final TaskPilotMetrics metrics;
    private final ProjectProperties project;
    private final Duration agentTimeout;
    private final Duration resultTimeout;

    public TaskStateMachine(@Lazy CheckpointStore store, AgentGateway gateway, ResultChannel resultChannel,
                            InstructionCatalog catalog, InstructionBuilder builder, TaskClassifier classifier,
                            ResultVerifier verifier, LifecycleFlags flags, EventBus eventBus,
                            StatusTrail statusTrail, TaskPilotMetrics metrics, ProjectProperties project,
                            AgentProperties agentProperties, ResultProperties resultProperties) {
        this.store = store;
        this.gateway = gateway;
        this.resultChannel = resultChannel;
        this.catalog = catalog;
        this.builder = builder;
        this.classifier = classifier;
        this.verifier = verifier;
        this.flags = flags;
        this.eventBus = eventBus;
        this.statusTrail = statusTrail;
        this.metrics = metrics;
        this.project = project;
        this.agentTimeout = agentProperties.getTimeout();
        this.resultTimeout = resultProperties.getTimeout();
    }

    /**
     * Runs a task that {@link CheckpointStore#startTask} has just marked in progress.
     */
    public TaskOutcome execute(TaskRecord task, String sessionId) {
        boolean previous = flags.setTaskInProgress(true);
        MdcContext.setTask(task.taskId());
        Instant started = Instant.now();
        try {
            TaskOutcome outcome = run(task, sessionId);
            if (!outcome.suspended()) {
                metrics.recordTaskResult(outcome.phase().value());
                metrics.recordTaskDuration(Duration.between(started, Instant.now()));
            }
            return outcome;
        } finally {
            MdcContext.clearTask();
            flags.setTaskInProgress(previous);
        }
    }

    private TaskOutcome run(TaskRecord task, String sessionId) {
        String taskId = task.taskId();
        String text = task.text();
        log.info("Starting task {} (attempt {}): {}", taskId, task.attempts(), text);
        statusTrail.taskStatus(text, "started", "attempt " + task.attempts());

        if (flags.consumeSkipRequest()) {
            return skip(task, sessionId, "skipped on request before analysis");
        }

        // analyzing
        String category = task.category() != null ? task.category() : classifier.categoryOf(text);
        List<InstructionTemplate> sequence = catalog.sequenceFor(category);
        int done = task.instructionProgress() < sequence.size() ? task.instructionProgress() : 0;
        String lastContent = null;
        if (!sequence.isEmpty() && task.instructionProgress() == sequence.size()) {
            lastContent = lastResultOnDisk(sequence.get(sequence.size() - 1), text, taskId);
            if (lastContent != null) {
                done = sequence.size();
            }
        }
        transition(task, sessionId, ExecutionPhase.ANALYZING, done, category);
        if (done > 0) {
            log.info("Resuming task {} after instruction {}/{}", taskId, done, sequence.size());
        }

        for (int n = done + 1; n <= sequence.size(); n++) {
            if (flags.consumeSkipRequest()) {
                return skip(task, sessionId, "skipped on request before instruction " + n);
            }
            if (flags.snapshot().shouldStop()) {
                return suspend(task, sessionId, n - 1);
            }

            // instructing(n)
            PreparedInstruction instruction = builder.build(sequence.get(n - 1), text, taskId);
            transition(task, sessionId, ExecutionPhase.INSTRUCTING, n - 1, category);
            Path instructionFile = resultChannel.publishInstruction(taskId, n, instruction.text());

            // executing(n), retried in place on gateway failure
            InvocationResult result = null;
            int retries = 0;
            while (result == null) {
                transition(task, sessionId, ExecutionPhase.EXECUTING, n - 1, category);
                InvocationResult attempt = gateway.invoke(instruction.text(), instructionFile, taskId, agentTimeout);
                if (attempt.success()) {
                    gateway.recordSuccess();
                    result = attempt;
                    continue;
                }
                ErrorDecision decision = gateway.handleError(attempt.errorMessage());
                if (decision == ErrorDecision.STOP) {
                    return fail(task, sessionId, "agent stopped: " + attempt.errorMessage());
                }
                retries++;
                if (retries >= gateway.maxInstructionRetries()) {
                    return fail(task, sessionId, "instruction " + n + " failed " + retries
                            + " times: " + attempt.errorMessage());
                }
                if (flags.consumeSkipRequest()) {
                    return skip(task, sessionId, "skipped on request during retries of instruction " + n);
                }
                if (flags.snapshot().shouldStop()) {
                    return suspend(task, sessionId, n - 1);
                }
                log.info("Retrying instruction {} of task {} (retry {})", n, taskId, retries);
            }

            // awaiting_result(n)
            transition(task, sessionId, ExecutionPhase.AWAITING_RESULT, n - 1, category);
            if (instruction.expectsResult()) {
                Duration timeout = instruction.timeout() != null ? instruction.timeout() : resultTimeout;
                var request = new ResultWaitRequest(taskId,
                        List.of(project.resolve(instruction.waitForFile())),
                        instruction.controlPhrase(), timeout);
                ResultWaitOutcome outcome = resultChannel.await(request);
                metrics.recordResultWait(outcome.success(), outcome.waitTime());
                if (!outcome.success()) {
                    return fail(task, sessionId, "no result for instruction " + n + " within "
                            + timeout.toSeconds() + "s");
                }
                lastContent = outcome.content();
            } else {
                lastContent = result.stdout();
            }
            store.recordProgress(taskId, ExecutionPhase.AWAITING_RESULT, n, category);
            log.info("Instruction {}/{} of task {} done", n, sequence.size(), taskId);
        }

        if (flags.consumeSkipRequest()) {
            return skip(task, sessionId, "skipped on request before verification");
        }

        // verifying
        transition(task, sessionId, ExecutionPhase.VERIFYING, sequence.size(), category);
        Verdict verdict = verifier.verify(text, lastContent);
        if (!verdict.accepted()) {
            return fail(task, sessionId, "verification rejected result: " + verdict.reason());
        }

        store.endTask(taskId, true);
        publish("task.completed", sessionId, taskId, Map.of("phase", ExecutionPhase.COMPLETED.value()));
        statusTrail.taskStatus(text, "completed", null);
        log.info("Task {} completed", taskId);
        return new TaskOutcome(taskId, ExecutionPhase.COMPLETED, null);
    }

    /**
     * Result of the final instruction left by an earlier attempt that died while verifying,
     * or null when it has to be produced again.
     */
    private String lastResultOnDisk(InstructionTemplate template, String text, String taskId) {
        PreparedInstruction last = builder.build(template, text, taskId);
        if (!last.expectsResult()) {
            return null;
        }
        Path file = project.resolve(last.waitForFile());
        if (!Files.isRegularFile(file)) {
            log.info("Result {} of task {} is gone, running all instructions again", file, taskId);
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot re-read result {} of task {}: {}", file, taskId, e.getMessage());
            return null;
        }
    }

    private void transition(TaskRecord task, String sessionId, ExecutionPhase phase, int progress, String category) {
        MdcContext.setPhase(phase.value());
        store.recordProgress(task.taskId(), phase, progress, category);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("phase", phase.value());
        payload.put("instruction_progress", progress);
        payload.put("category", category);
        publish("task.phase", sessionId, task.taskId(), payload);
        log.debug("Task {} -> {} (progress {})", task.taskId(), phase.value(), progress);
    }

    private TaskOutcome fail(TaskRecord task, String sessionId, String reason) {
        store.endTask(task.taskId(), false, reason);
        publish("task.failed", sessionId, task.taskId(), Map.of("reason", reason));
        statusTrail.taskStatus(task.text(), "failed", reason);
        log.warn("Task {} failed: {}", task.taskId(), reason);
        return new TaskOutcome(task.taskId(), ExecutionPhase.FAILED, reason);
    }

    private TaskOutcome skip(TaskRecord task, String sessionId, String reason) {
        store.skipTask(task.taskId(), task.text(), reason);
        publish("task.skipped", sessionId, task.taskId(), Map.of("reason", reason));
        statusTrail.taskStatus(task.text(), "skipped", reason);
        log.info("Task {} skipped: {}", task.taskId(), reason);
        return new TaskOutcome(task.taskId(), ExecutionPhase.SKIPPED, reason);
    }

    private TaskOutcome suspend(TaskRecord task, String sessionId, int progress) {
        store.suspendTask(task.taskId());
        publish("task.suspended", sessionId, task.taskId(), Map.of("instruction_progress", progress));
        statusTrail.taskStatus(task.text(), "suspended", "stop requested after instruction " + progress);
        log.info("Task {} suspended after instruction {}", task.taskId(), progress);
        return new TaskOutcome(task.taskId(), ExecutionPhase.QUEUED, "suspended");
    }

    private void publish(String type, String sessionId, String taskId, Map<String, Object> payload) {
        eventBus.publish(TaskPilotEvent.of(type, sessionId, taskId, payload));
    }
}
