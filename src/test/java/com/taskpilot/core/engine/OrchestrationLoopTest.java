package com.taskpilot.core.engine;

import com.taskpilot.agent.AgentExecution;
import com.taskpilot.agent.AgentInvocationException;
import com.taskpilot.agent.AgentRequest;
import com.taskpilot.core.checkpoint.CheckpointFiles;
import com.taskpilot.core.lifecycle.ReloadRequestedException;
import com.taskpilot.core.model.CheckpointLedger;
import com.taskpilot.core.model.ControlCommand;
import com.taskpilot.core.model.TaskRecord;
import com.taskpilot.core.model.TaskState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class OrchestrationLoopTest {

    @TempDir
    Path tempDir;

    private void answerWithResult(EngineFixture fixture, String content) {
        when(fixture.provider.execute(any())).thenAnswer(inv -> {
            AgentRequest request = inv.getArgument(0);
            fixture.writeResult(request.taskId(), content);
            return new AgentExecution(0, "", "", 1);
        });
    }

    @Test
    @DisplayName("transient agent errors are retried in place and the task completes on its first attempt")
    void endToEndWithTransientErrors() throws IOException {
        var fixture = new EngineFixture(tempDir, "# Tasks\n\n- [ ] add feature A\n");
        AtomicInteger calls = new AtomicInteger();
        when(fixture.provider.execute(any())).thenAnswer(inv -> {
            if (calls.incrementAndGet() <= 2) {
                throw new AgentInvocationException("connection reset");
            }
            AgentRequest request = inv.getArgument(0);
            fixture.writeResult(request.taskId(), "DONE-A");
            return new AgentExecution(0, "", "", 1);
        });
        fixture.stopAfter("task.completed", 1);

        boolean clean = fixture.loop().run("session_1");

        assertTrue(clean);
        assertEquals(3, calls.get());
        List<TaskRecord> tasks = fixture.store.getTasks();
        assertEquals(1, tasks.size());
        assertEquals(TaskState.COMPLETED, tasks.get(0).state());
        assertEquals(1, tasks.get(0).attempts());
        assertTrue(fixture.todoText().contains("- [x] add feature A"));

        CheckpointLedger ledger = CheckpointFiles.read(fixture.store.file()).orElseThrow();
        assertTrue(ledger.cleanShutdown());
        assertEquals("test finished", ledger.stopReason());
        verifyNoInteractions(fixture.restarter);
    }

    @Test
    @DisplayName("tasks the ledger already completed are ticked off without running")
    void completedInLedger() {
        var fixture = new EngineFixture(tempDir, "- [ ] old task\n- [ ] new task\n");
        TaskRecord old = fixture.store.startTask(TaskRecord.queued("task_old", "old task"));
        fixture.store.endTask(old.taskId(), true);
        answerWithResult(fixture, "DONE");
        fixture.stopAfter("task.completed", 1);

        fixture.loop().run("s");

        ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
        verify(fixture.provider, times(1)).execute(captor.capture());
        assertEquals("Implement new task", captor.getValue().instruction());
        assertTrue(fixture.todoText().contains("- [x] old task"));
        assertTrue(fixture.todoText().contains("- [x] new task"));
    }

    @Test
    @DisplayName("a task failing on every attempt is marked skipped in the TODO")
    void givesUpAfterMaxAttempts() {
        var fixture = new EngineFixture(tempDir, "- [ ] flaky task\n");
        fixture.loopProperties.setMaxTaskAttempts(2);
        answerWithResult(fixture, "TASK FAILED\nDONE");
        fixture.stopAfter("task.failed", 2);

        fixture.loop().run("s");

        TaskRecord record = fixture.store.getTasks().get(0);
        assertEquals(TaskState.FAILED, record.state());
        assertEquals(2, record.attempts());
        assertTrue(fixture.todoText().contains("- [~] flaky task <!-- failed after 2 attempts"));
    }

    @Test
    @DisplayName("TODO lines added while a task runs are kept when the task is ticked off")
    void editDuringTaskSurvives() {
        var fixture = new EngineFixture(tempDir, "- [ ] a\n");
        AtomicInteger calls = new AtomicInteger();
        when(fixture.provider.execute(any())).thenAnswer(inv -> {
            AgentRequest request = inv.getArgument(0);
            if (calls.getAndIncrement() == 0) {
                Files.writeString(fixture.project.todoPath(), "- [ ] b added by user\n",
                        StandardOpenOption.APPEND);
            }
            fixture.writeResult(request.taskId(), "DONE");
            return new AgentExecution(0, "", "", 1);
        });
        fixture.stopAfter("task.completed", 2);

        fixture.loop().run("s");

        String todo = fixture.todoText();
        assertTrue(todo.contains("- [x] a"));
        assertTrue(todo.contains("- [x] b added by user"));
        verify(fixture.provider, times(2)).execute(any());
    }

    @Nested
    @DisplayName("lifecycle flags")
    class Lifecycle {

        @Test
        @DisplayName("stop wins over a pending reload")
        void stopBeatsReload() {
            var fixture = new EngineFixture(tempDir, "- [ ] a\n");
            fixture.flags.requestReload("watcher");
            fixture.flags.requestStop("operator", false);

            assertTrue(fixture.loop().run("s"));
            verifyNoInteractions(fixture.provider);
        }

        @Test
        @DisplayName("a skip sent before any task starts does not touch the next task")
        void skipWhileIdle() {
            var fixture = new EngineFixture(tempDir, "- [ ] a\n");
            fixture.flags.requestSkipCurrent();
            answerWithResult(fixture, "DONE");
            fixture.stopAfter("task.completed", 1);

            fixture.loop().run("s");

            assertEquals(TaskState.COMPLETED, fixture.store.getTasks().get(0).state());
            assertTrue(fixture.todoText().contains("- [x] a"));
        }

        @Test
        @DisplayName("critical stop ends the session uncleanly")
        void criticalStop() throws IOException {
            var fixture = new EngineFixture(tempDir, "- [ ] a\n");
            fixture.flags.requestStop("restart budget exhausted", true);

            assertFalse(fixture.loop().run("s"));
            CheckpointLedger ledger = CheckpointFiles.read(fixture.store.file()).orElseThrow();
            assertFalse(ledger.cleanShutdown());
            assertEquals("restart budget exhausted", ledger.stopReason());
        }

        @Test
        @DisplayName("idle reload closes the session cleanly and throws")
        void idleReload() throws IOException {
            var fixture = new EngineFixture(tempDir, "- [ ] a\n");
            fixture.flags.requestReload("watcher");

            assertThrows(ReloadRequestedException.class, () -> fixture.loop().run("s"));
            assertFalse(fixture.flags.snapshot().shouldReload());
            CheckpointLedger ledger = CheckpointFiles.read(fixture.store.file()).orElseThrow();
            assertTrue(ledger.cleanShutdown());
            assertEquals("reload", ledger.stopReason());
        }

        @Test
        @DisplayName("reload requested mid-task waits for the task to finish")
        void deferredReload() {
            var fixture = new EngineFixture(tempDir, "- [ ] a\n- [ ] b\n");
            when(fixture.provider.execute(any())).thenAnswer(inv -> {
                AgentRequest request = inv.getArgument(0);
                fixture.flags.requestReload("watcher");
                fixture.writeResult(request.taskId(), "DONE");
                return new AgentExecution(0, "", "", 1);
            });

            assertThrows(ReloadRequestedException.class, () -> fixture.loop().run("s"));
            verify(fixture.provider, times(1)).execute(any());
            assertTrue(fixture.todoText().contains("- [x] a"));
            assertTrue(fixture.todoText().contains("- [ ] b"));
        }
    }

    @Nested
    @DisplayName("control commands")
    class Commands {

        @Test
        @DisplayName("added task at head runs first, duplicates are ignored")
        void addTask() {
            var fixture = new EngineFixture(tempDir, "- [ ] existing\n");
            fixture.flags.enqueue(new ControlCommand.AddTask("urgent", true));
            fixture.flags.enqueue(new ControlCommand.AddTask("existing", false));
            answerWithResult(fixture, "DONE");
            fixture.stopAfter("task.completed", 2);

            fixture.loop().run("s");

            ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
            verify(fixture.provider, times(2)).execute(captor.capture());
            assertEquals(List.of("Implement urgent", "Implement existing"),
                    captor.getAllValues().stream().map(AgentRequest::instruction).toList());
            assertEquals(2, fixture.todo.items().size());
        }

        @Test
        @DisplayName("clear removes pending tasks before they run")
        void clearTasks() {
            var fixture = new EngineFixture(tempDir, "- [x] done before\n- [ ] pending one\n- [ ] pending two\n");
            fixture.flags.enqueue(new ControlCommand.ClearTasks());
            fixture.flags.enqueue(new ControlCommand.AddTask("fresh", false));
            answerWithResult(fixture, "DONE");
            fixture.stopAfter("task.completed", 1);

            fixture.loop().run("s");

            verify(fixture.provider, times(1)).execute(any());
            String todo = fixture.todoText();
            assertTrue(todo.contains("- [x] done before"));
            assertFalse(todo.contains("pending one"));
            assertTrue(todo.contains("- [x] fresh"));
        }
    }
}
