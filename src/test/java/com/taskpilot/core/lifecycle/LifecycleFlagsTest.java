package com.taskpilot.core.lifecycle;

import com.taskpilot.core.model.ControlCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleFlagsTest {

    private LifecycleFlags flags;

    @BeforeEach
    void setUp() {
        flags = new LifecycleFlags();
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        @DisplayName("first reason wins, critical can only be raised")
        void firstReasonWins() {
            flags.requestStop("control api", false);
            flags.requestStop("critical agent error", true);
            flags.requestStop("shutdown", false);

            var snapshot = flags.snapshot();
            assertTrue(snapshot.shouldStop());
            assertEquals("control api", snapshot.stopReason());
            assertTrue(snapshot.stopCritical());
        }

        @Test
        @DisplayName("awaitStop wakes up when another thread requests a stop")
        void awaitStopWakesUp() throws Exception {
            var woke = new AtomicBoolean();
            var done = new CountDownLatch(1);
            Thread waiter = new Thread(() -> {
                try {
                    woke.set(flags.awaitStop(Duration.ofSeconds(30)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                done.countDown();
            });
            waiter.start();

            Thread.sleep(50);
            flags.requestStop("test", false);

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertTrue(woke.get());
        }

        @Test
        @DisplayName("awaitStop times out without a stop")
        void awaitStopTimesOut() throws InterruptedException {
            assertFalse(flags.awaitStop(Duration.ofMillis(20)));
        }
    }

    @Nested
    @DisplayName("reload")
    class Reload {

        @Test
        @DisplayName("idle reload is due at once and counts idle signals")
        void idleReload() {
            flags.requestReload("watcher");
            flags.requestReload("watcher");

            var snapshot = flags.snapshot();
            assertTrue(snapshot.shouldReload());
            assertEquals(2, snapshot.consecutiveIdleReloadSignals());
        }

        @Test
        @DisplayName("reload during a task is deferred until the task ends")
        void deferredReload() {
            flags.setTaskInProgress(true);
            flags.requestReload("control api");

            var during = flags.snapshot();
            assertFalse(during.shouldReload());
            assertTrue(during.reloadAfterCurrentTask());

            flags.setTaskInProgress(false);

            var after = flags.snapshot();
            assertTrue(after.shouldReload());
            assertFalse(after.reloadAfterCurrentTask());
        }

        @Test
        @DisplayName("completing a reload clears every reload flag")
        void completeReload() {
            flags.requestReload("watcher");
            flags.completeReload();

            var snapshot = flags.snapshot();
            assertFalse(snapshot.shouldReload());
            assertEquals(0, snapshot.consecutiveIdleReloadSignals());
        }
    }

    @Test
    @DisplayName("setTaskInProgress returns the previous value for nesting")
    void nestedTaskInProgress() {
        assertFalse(flags.setTaskInProgress(true));
        assertTrue(flags.setTaskInProgress(true));
        flags.setTaskInProgress(true);
        assertTrue(flags.snapshot().taskInProgress());
    }

    @Test
    @DisplayName("skip request is consumed once")
    void skipConsumedOnce() {
        flags.setTaskInProgress(true);
        assertTrue(flags.requestSkipCurrent());
        assertTrue(flags.consumeSkipRequest());
        assertFalse(flags.consumeSkipRequest());
    }

    @Test
    @DisplayName("skip with nothing running is a no-op")
    void skipWhileIdleIgnored() {
        assertFalse(flags.requestSkipCurrent());
        assertFalse(flags.snapshot().skipCurrentRequested());
        assertFalse(flags.consumeSkipRequest());
    }

    @Test
    @DisplayName("an unapplied skip ends with its task")
    void skipDroppedWhenTaskEnds() {
        flags.setTaskInProgress(true);
        flags.requestSkipCurrent();
        flags.setTaskInProgress(false);

        assertFalse(flags.snapshot().skipCurrentRequested());
        flags.setTaskInProgress(true);
        assertFalse(flags.consumeSkipRequest());
    }

    @Test
    @DisplayName("commands drain in order and wake awaitChange")
    void commandsDrainInOrder() throws InterruptedException {
        flags.enqueue(new ControlCommand.AddTask("a", false));
        flags.enqueue(new ControlCommand.ClearTasks());

        assertTrue(flags.awaitChange(Duration.ofSeconds(5)));
        var drained = flags.drainCommands();

        assertEquals(2, drained.size());
        assertInstanceOf(ControlCommand.AddTask.class, drained.get(0));
        assertInstanceOf(ControlCommand.ClearTasks.class, drained.get(1));
        assertTrue(flags.drainCommands().isEmpty());
        assertFalse(flags.awaitChange(Duration.ofMillis(10)));
    }
}
