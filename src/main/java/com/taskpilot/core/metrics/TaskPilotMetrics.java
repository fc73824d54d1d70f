package com.taskpilot.core.metrics;

import com.taskpilot.core.model.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task orchestration.
 */
@Service
public class TaskPilotMetrics {

    private final MeterRegistry registry;

    public TaskPilotMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskResult(String state) {
        Counter.builder("taskpilot.tasks.total")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordTaskDuration(Duration duration) {
        Timer.builder("taskpilot.task.duration")
                .register(registry)
                .record(duration);
    }

    public void recordInvocation(boolean success, long ms) {
        Timer.builder("taskpilot.agent.invocation.duration")
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAgentError(ErrorCategory category) {
        Counter.builder("taskpilot.agent.errors")
                .tag("category", category.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * @param success whether the backend answered after the restart
     */
    public void recordEnvironmentRestart(boolean success) {
        Counter.builder("taskpilot.agent.restarts")
                .description("Environment restarts of the agent backend")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordResultWait(boolean success, Duration waited) {
        Timer.builder("taskpilot.result.wait")
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(waited);
    }

    public void recordBackoff(Duration delay) {
        DistributionSummary.builder("taskpilot.agent.backoff.seconds")
                .description("Backoff delay applied after an agent error")
                .register(registry)
                .record(delay.toSeconds());
    }

    public void incrementIterations() {
        Counter.builder("taskpilot.loop.iterations")
                .register(registry)
                .increment();
    }
}
