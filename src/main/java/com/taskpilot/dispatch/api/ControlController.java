package com.taskpilot.dispatch.api;

import com.taskpilot.agent.AgentGateway;
import com.taskpilot.core.checkpoint.CheckpointFiles;
import com.taskpilot.core.checkpoint.CheckpointProperties;
import com.taskpilot.core.checkpoint.CheckpointStore;
import com.taskpilot.core.lifecycle.LifecycleFlags;
import com.taskpilot.core.model.CheckpointLedger;
import com.taskpilot.core.model.ControlCommand;
import com.taskpilot.core.model.TaskState;
import com.taskpilot.core.todo.ProjectProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST control surface for a running orchestrator.
 *
 * <p>Every mutation only records a flag or queues a command and returns 202; the loop
 * applies it at its next safe point.
 */
@RestController
@RequestMapping("/api/v1/control")
public class ControlController {

    private static final Logger log = LoggerFactory.getLogger(ControlController.class);

    private final LifecycleFlags flags;
    private final AgentGateway gateway;
    private final ProjectProperties project;
    private final CheckpointProperties checkpoint;
    private final SseStreamingService sseStreamingService;

    public ControlController(LifecycleFlags flags, AgentGateway gateway, ProjectProperties project,
                             CheckpointProperties checkpoint, SseStreamingService sseStreamingService) {
        this.flags = flags;
        this.gateway = gateway;
        this.project = project;
        this.checkpoint = checkpoint;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/control/stop: Stop after the current step.
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        flags.requestStop("control api", false);
        return accepted("stop");
    }

    /**
     * POST /api/v1/control/reload: Restart the loop once no task is running.
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, String>> reload() {
        flags.requestReload("control api");
        return accepted("reload");
    }

    @PostMapping("/tasks")
    public ResponseEntity<Map<String, String>> addTask(@RequestBody AddTaskRequest request) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "text is required"));
        }
        String text = request.text().strip();
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            // one TODO line per task
            return ResponseEntity.badRequest().body(Map.of("error", "text must be a single line"));
        }
        String position = request.position() == null ? "tail" : request.position().toLowerCase();
        if (!position.equals("head") && !position.equals("tail")) {
            return ResponseEntity.badRequest().body(Map.of("error", "position must be head or tail"));
        }
        flags.enqueue(new ControlCommand.AddTask(text, position.equals("head")));
        log.info("Queued new task at {}: {}", position, text);
        return accepted("add_task");
    }

    @DeleteMapping("/tasks")
    public ResponseEntity<Map<String, String>> clearTasks() {
        flags.enqueue(new ControlCommand.ClearTasks());
        return accepted("clear_tasks");
    }

    @PostMapping("/tasks/current/skip")
    public ResponseEntity<Map<String, String>> skipCurrent() {
        if (!flags.requestSkipCurrent()) {
            return ResponseEntity.status(409).body(Map.of("error", "no task in progress"));
        }
        return accepted("skip_current_task");
    }

    /**
     * GET /api/v1/control/status: Lifecycle flags, agent error streak and ledger summary.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        var snapshot = flags.snapshot();
        Map<String, Object> lifecycle = new LinkedHashMap<>();
        lifecycle.put("should_stop", snapshot.shouldStop());
        lifecycle.put("stop_reason", snapshot.stopReason());
        lifecycle.put("stop_critical", snapshot.stopCritical());
        lifecycle.put("should_reload", snapshot.shouldReload());
        lifecycle.put("reload_after_current_task", snapshot.reloadAfterCurrentTask());
        lifecycle.put("task_in_progress", snapshot.taskInProgress());
        lifecycle.put("consecutive_idle_reload_signals", snapshot.consecutiveIdleReloadSignals());
        lifecycle.put("skip_current_requested", snapshot.skipCurrentRequested());
        lifecycle.put("pending_commands", snapshot.pendingCommands());

        Map<String, Object> agent = new LinkedHashMap<>();
        agent.put("error_streak", gateway.streakCount());
        agent.put("current_delay_seconds", gateway.currentDelay().toSeconds());
        agent.put("failed_restarts", gateway.failedRestarts());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("lifecycle", lifecycle);
        result.put("agent", agent);

        Path file = project.resolve(checkpoint.getFile());
        try {
            Optional<CheckpointLedger> ledger = CheckpointFiles.read(file);
            ledger.ifPresent(l -> {
                Map<String, Object> session = new LinkedHashMap<>();
                session.put("session_id", l.sessionId());
                session.put("last_start_time", l.lastStartTime());
                session.put("last_stop_time", l.lastStopTime());
                session.put("clean_shutdown", l.cleanShutdown());
                session.put("stop_reason", l.stopReason());
                result.put("session", session);
                result.put("statistics", CheckpointStore.Statistics.of(l));
                l.tasks().stream()
                        .filter(t -> t.state() == TaskState.IN_PROGRESS)
                        .findFirst()
                        .ifPresent(t -> result.put("current_task", t));
            });
        } catch (IOException e) {
            log.warn("Cannot read checkpoint {} for status: {}", file, e.getMessage());
            result.put("checkpoint_error", e.getMessage());
        }
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/control/events: SSE stream of orchestrator events, optionally for one task.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@RequestParam(name = "task_id", required = false) String taskId) {
        return ResponseEntity.ok(sseStreamingService.createEmitter(taskId));
    }

    private static ResponseEntity<Map<String, String>> accepted(String action) {
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "action", action));
    }
}
