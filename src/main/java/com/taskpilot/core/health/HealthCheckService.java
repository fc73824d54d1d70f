package com.taskpilot.core.health;

import com.taskpilot.agent.AgentProvider;
import com.taskpilot.core.checkpoint.CheckpointFiles;
import com.taskpilot.core.checkpoint.CheckpointProperties;
import com.taskpilot.core.todo.ProjectProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Component health for the CLI and the REST endpoint. Reads files only; never opens
 * the checkpoint store, so it is safe while an orchestrator is running.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AgentProvider agentProvider;
    private final ProjectProperties project;
    private final CheckpointProperties checkpoint;

    public HealthCheckService(
            @Autowired(required = false) AgentProvider agentProvider,
            ProjectProperties project,
            CheckpointProperties checkpoint) {
        this.agentProvider = agentProvider;
        this.project = project;
        this.checkpoint = checkpoint;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkAgent());
        results.add(checkCheckpoint());
        results.add(checkTodo());
        return results;
    }

    private HealthStatus checkAgent() {
        if (agentProvider == null) {
            return new HealthStatus("agent", HealthStatus.Status.DOWN,
                    "No AgentProvider configured", Map.of());
        }
        try {
            if (agentProvider.probe()) {
                return new HealthStatus("agent", HealthStatus.Status.UP,
                        "Agent backend answers", Map.of("provider", agentProvider.name()));
            }
            return new HealthStatus("agent", HealthStatus.Status.DOWN,
                    "Agent backend does not answer", Map.of("provider", agentProvider.name()));
        } catch (Exception e) {
            log.warn("Agent health check failed: {}", e.getMessage());
            return new HealthStatus("agent", HealthStatus.Status.DOWN,
                    "Agent error: " + e.getMessage(), Map.of("provider", agentProvider.name()));
        }
    }

    private HealthStatus checkCheckpoint() {
        Path file = project.resolve(checkpoint.getFile());
        try {
            return CheckpointFiles.read(file)
                    .map(ledger -> new HealthStatus("checkpoint", HealthStatus.Status.UP,
                            "Ledger readable (" + ledger.tasks().size() + " tasks)",
                            Map.of("file", file.toString())))
                    .orElseGet(() -> new HealthStatus("checkpoint", HealthStatus.Status.UP,
                            "No ledger yet", Map.of("file", file.toString())));
        } catch (Exception e) {
            log.warn("Checkpoint health check failed: {}", e.getMessage());
            return new HealthStatus("checkpoint", HealthStatus.Status.DEGRADED,
                    "Ledger unreadable: " + e.getMessage(), Map.of("file", file.toString()));
        }
    }

    private HealthStatus checkTodo() {
        Path file = project.todoPath();
        if (Files.isRegularFile(file)) {
            return new HealthStatus("todo", HealthStatus.Status.UP,
                    "TODO file present", Map.of("file", file.toString()));
        }
        return new HealthStatus("todo", HealthStatus.Status.DEGRADED,
                "TODO file missing", Map.of("file", file.toString()));
    }
}
