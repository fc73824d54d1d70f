package com.taskpilot.agent;

import com.taskpilot.core.classifier.ClassifierPatterns;
import com.taskpilot.core.classifier.FailureClassifier;
import com.taskpilot.core.lifecycle.LifecycleFlags;
import com.taskpilot.core.metrics.TaskPilotMetrics;
import com.taskpilot.core.model.InvocationResult;
import com.taskpilot.core.status.StatusTrail;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AgentGatewayTest {

    @TempDir
    Path tempDir;

    private AgentProvider provider;
    private EnvironmentRestarter restarter;
    private LifecycleFlags flags;
    private SimpleMeterRegistry registry;
    private AgentProperties properties;

    @BeforeEach
    void setUp() {
        provider = mock(AgentProvider.class);
        restarter = mock(EnvironmentRestarter.class);
        flags = new LifecycleFlags();
        registry = new SimpleMeterRegistry();
        properties = new AgentProperties();
        properties.getRetry().setInitialDelay(Duration.ofMillis(10));
        properties.getRetry().setDelayIncrement(Duration.ofMillis(10));
    }

    private AgentGateway gateway() {
        return new AgentGateway(provider, restarter, new FailureClassifier(ClassifierPatterns.defaults()),
                flags, new StatusTrail(tempDir.resolve("status.md"), Clock.systemDefaultZone()),
                new TaskPilotMetrics(registry), properties);
    }

    @Nested
    @DisplayName("invoke")
    class Invoke {

        @Test
        @DisplayName("zero exit is a success carrying stdout")
        void success() {
            when(provider.execute(any())).thenReturn(new AgentExecution(0, "done", "", 12));

            InvocationResult result = gateway().invoke("do it", "task_1", Duration.ofSeconds(5));

            assertTrue(result.success());
            assertEquals("done", result.stdout());
            assertNull(result.errorMessage());
        }

        @Test
        @DisplayName("non-zero exit becomes a failure naming the exit code")
        void nonZeroExit() {
            when(provider.execute(any())).thenReturn(new AgentExecution(2, "", "model overloaded", 5));

            InvocationResult result = gateway().invoke("do it", "task_1", Duration.ofSeconds(5));

            assertFalse(result.success());
            assertEquals(2, result.returnCode());
            assertTrue(result.errorMessage().startsWith("agent exited with code 2"));
            assertTrue(result.errorMessage().contains("model overloaded"));
        }

        @Test
        @DisplayName("transport failures never escape")
        void transportFailure() {
            when(provider.execute(any())).thenThrow(new AgentInvocationException("connection reset"));

            InvocationResult result = gateway().invoke("do it", "task_1", Duration.ofSeconds(5));

            assertFalse(result.success());
            assertEquals("connection reset", result.errorMessage());
        }

        @Test
        @DisplayName("unexpected runtime failures are reported as unknown errors")
        void unexpectedFailure() {
            when(provider.execute(any())).thenThrow(new IllegalStateException("bug"));

            InvocationResult result = gateway().invoke("do it", "task_1", Duration.ofSeconds(5));

            assertFalse(result.success());
            assertEquals("unknown error: bug", result.errorMessage());
        }
    }

    @Nested
    @DisplayName("handleError")
    class HandleError {

        @Test
        @DisplayName("critical error stops without a restart")
        void criticalStops() {
            var gateway = gateway();

            assertEquals(ErrorDecision.STOP, gateway.handleError("402 Payment Required"));

            verify(restarter, never()).restartEnvironment();
            var snapshot = flags.snapshot();
            assertTrue(snapshot.shouldStop());
            assertTrue(snapshot.stopCritical());
        }

        @Test
        @DisplayName("early recoverable error restarts the environment and resets the streak")
        void recoverableRestarts() {
            when(restarter.restartEnvironment()).thenReturn(true);
            var gateway = gateway();

            assertEquals(ErrorDecision.CONTINUE, gateway.handleError("backend unavailable"));

            verify(restarter).restartEnvironment();
            assertEquals(0, gateway.streakCount());
            assertFalse(flags.snapshot().shouldStop());
        }

        @Test
        @DisplayName("transient errors back off with growing delay, then restart at the threshold")
        void transientEscalates() {
            when(restarter.restartEnvironment()).thenReturn(true);
            var gateway = gateway();

            assertEquals(ErrorDecision.CONTINUE, gateway.handleError("connection reset"));
            assertEquals(Duration.ofMillis(10), gateway.currentDelay());
            assertEquals(ErrorDecision.CONTINUE, gateway.handleError("connection reset"));
            assertEquals(Duration.ofMillis(20), gateway.currentDelay());
            verify(restarter, never()).restartEnvironment();

            assertEquals(ErrorDecision.CONTINUE, gateway.handleError("connection reset"));
            verify(restarter).restartEnvironment();
            assertEquals(0, gateway.streakCount());
        }

        @Test
        @DisplayName("failed restart at the repeat threshold stops critically")
        void failedRestartAtThresholdStops() {
            when(restarter.restartEnvironment()).thenReturn(false);
            var gateway = gateway();

            gateway.handleError("connection reset");
            gateway.handleError("connection reset");
            assertEquals(ErrorDecision.STOP, gateway.handleError("connection reset"));

            assertTrue(flags.snapshot().stopCritical());
            assertEquals(1, gateway.failedRestarts());
        }

        @Test
        @DisplayName("exhausted restart budget stops on the next recoverable error")
        void restartBudgetExhausted() {
            properties.getRetry().setMaxRestartAttempts(1);
            when(restarter.restartEnvironment()).thenReturn(false);
            var gateway = gateway();

            assertEquals(ErrorDecision.STOP, gateway.handleError("unknown error: socket closed"));

            verify(restarter, times(1)).restartEnvironment();
            assertTrue(flags.snapshot().stopReason().contains("exhausted"));
        }

        @Test
        @DisplayName("success resets streak and restart budget")
        void successResets() {
            when(restarter.restartEnvironment()).thenReturn(false);
            var gateway = gateway();
            gateway.handleError("backend unavailable");
            assertEquals(1, gateway.failedRestarts());

            gateway.recordSuccess();

            assertEquals(0, gateway.streakCount());
            assertEquals(0, gateway.failedRestarts());
        }

        @Test
        @DisplayName("backoff ends early when a stop is pending")
        void backoffInterruptedByStop() {
            properties.getRetry().setInitialDelay(Duration.ofSeconds(30));
            var gateway = gateway();
            flags.requestStop("control api", false);

            long start = System.nanoTime();
            assertEquals(ErrorDecision.CONTINUE, gateway.handleError("connection reset"));

            assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(5)) < 0);
        }

        @Test
        @DisplayName("errors are counted by category")
        void errorMetrics() {
            var gateway = gateway();
            gateway.handleError("connection reset");

            var counter = registry.find("taskpilot.agent.errors").tag("category", "transient").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }
    }
}
