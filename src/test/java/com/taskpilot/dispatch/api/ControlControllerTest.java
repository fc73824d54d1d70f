package com.taskpilot.dispatch.api;

import com.taskpilot.agent.AgentGateway;
import com.taskpilot.core.checkpoint.CheckpointProperties;
import com.taskpilot.core.checkpoint.JsonCheckpointStore;
import com.taskpilot.core.lifecycle.LifecycleFlags;
import com.taskpilot.core.model.ControlCommand;
import com.taskpilot.core.model.TaskRecord;
import com.taskpilot.core.todo.ProjectProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.time.Duration;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ControlController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ControlControllerTest {

    @TempDir
    Path tempDir;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LifecycleFlags flags;

    @MockitoBean
    private AgentGateway gateway;

    @MockitoBean
    private ProjectProperties project;

    @MockitoBean
    private CheckpointProperties checkpoint;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private Path ledgerFile;

    @BeforeEach
    void setUp() {
        ledgerFile = tempDir.resolve("checkpoint.json");
        when(checkpoint.getFile()).thenReturn("checkpoint.json");
        when(project.resolve(anyString())).thenReturn(ledgerFile);
        when(flags.snapshot()).thenReturn(new LifecycleFlags.Snapshot(
                false, null, false, false, true, true, 0, false, 2));
        when(gateway.streakCount()).thenReturn(2);
        when(gateway.currentDelay()).thenReturn(Duration.ofSeconds(60));
        when(gateway.failedRestarts()).thenReturn(0);
    }

    @Test
    @DisplayName("POST /stop records an orderly stop and returns 202")
    void stop() throws Exception {
        mockMvc.perform(post("/api/v1/control/stop"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.action").value("stop"));

        verify(flags).requestStop("control api", false);
    }

    @Test
    @DisplayName("POST /reload requests a reload")
    void reload() throws Exception {
        mockMvc.perform(post("/api/v1/control/reload"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.action").value("reload"));

        verify(flags).requestReload("control api");
    }

    @Test
    @DisplayName("POST /tasks queues the stripped text at the requested position")
    void addTask() throws Exception {
        mockMvc.perform(post("/api/v1/control/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"  write docs  ","position":"head"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.action").value("add_task"));

        verify(flags).enqueue(new ControlCommand.AddTask("write docs", true));
    }

    @Test
    @DisplayName("POST /tasks defaults to the tail")
    void addTaskDefaultsToTail() throws Exception {
        mockMvc.perform(post("/api/v1/control/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"write docs\"}"))
                .andExpect(status().isAccepted());

        verify(flags).enqueue(new ControlCommand.AddTask("write docs", false));
    }

    @Test
    @DisplayName("POST /tasks rejects blank text and unknown positions")
    void addTaskValidation() throws Exception {
        mockMvc.perform(post("/api/v1/control/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("text is required"));

        mockMvc.perform(post("/api/v1/control/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"x\",\"position\":\"middle\"}"))
                .andExpect(status().isBadRequest());

        verify(flags, never()).enqueue(org.mockito.ArgumentMatchers.any());
    }

    @Test
    @DisplayName("GET /events opens a stream for one task or for everything")
    void streamEvents() throws Exception {
        when(sseStreamingService.createEmitter(any())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/control/events").param("task_id", "task_3"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/control/events"))
                .andExpect(status().isOk());

        verify(sseStreamingService).createEmitter("task_3");
        verify(sseStreamingService).createEmitter(isNull());
    }

    @Test
    @DisplayName("POST /tasks rejects text spanning several lines")
    void addTaskRejectsLineBreaks() throws Exception {
        mockMvc.perform(post("/api/v1/control/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"a\\n- [ ] b\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("text must be a single line"));

        mockMvc.perform(post("/api/v1/control/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"a\\r\\nb\"}"))
                .andExpect(status().isBadRequest());

        verify(flags, never()).enqueue(org.mockito.ArgumentMatchers.any());
    }

    @Test
    @DisplayName("DELETE /tasks queues a clear")
    void clearTasks() throws Exception {
        mockMvc.perform(delete("/api/v1/control/tasks"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.action").value("clear_tasks"));

        verify(flags).enqueue(new ControlCommand.ClearTasks());
    }

    @Test
    @DisplayName("POST /tasks/current/skip requests a skip")
    void skipCurrent() throws Exception {
        when(flags.requestSkipCurrent()).thenReturn(true);

        mockMvc.perform(post("/api/v1/control/tasks/current/skip"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.action").value("skip_current_task"));

        verify(flags).requestSkipCurrent();
    }

    @Test
    @DisplayName("POST /tasks/current/skip with nothing running returns 409")
    void skipWithNothingRunning() throws Exception {
        when(flags.requestSkipCurrent()).thenReturn(false);

        mockMvc.perform(post("/api/v1/control/tasks/current/skip"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("no task in progress"));
    }

    @Test
    @DisplayName("GET /status without a ledger shows flags and the agent streak only")
    void statusWithoutLedger() throws Exception {
        mockMvc.perform(get("/api/v1/control/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lifecycle.reload_after_current_task").value(true))
                .andExpect(jsonPath("$.lifecycle.pending_commands").value(2))
                .andExpect(jsonPath("$.agent.error_streak").value(2))
                .andExpect(jsonPath("$.agent.current_delay_seconds").value(60))
                .andExpect(jsonPath("$.session").doesNotExist());
    }

    @Test
    @DisplayName("GET /status includes session, statistics and the task in progress")
    void statusWithLedger() throws Exception {
        var store = JsonCheckpointStore.open(ledgerFile);
        store.markServerStart("session_7");
        store.startTask(TaskRecord.queued("task_9", "add feature A"));

        mockMvc.perform(get("/api/v1/control/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session.session_id").value("session_7"))
                .andExpect(jsonPath("$.statistics.inProgress").value(1))
                .andExpect(jsonPath("$.current_task.task_id").value("task_9"))
                .andExpect(jsonPath("$.current_task.task_text", containsString("feature A")));
    }
}
