package com.taskpilot.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the orchestrator runs.
 *
 * @param eventType event type, e.g. "task.phase", "task.completed", "agent.restart"
 * @param sessionId the session that emitted it
 * @param taskId    the task it relates to, null for session-level events
 * @param payload   event data
 * @param timestamp when it happened
 */
public record TaskPilotEvent(
    String eventType,
    String sessionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static TaskPilotEvent of(String eventType, String sessionId, String taskId, Map<String, Object> payload) {
        return new TaskPilotEvent(eventType, sessionId, taskId, Map.copyOf(payload), Instant.now());
    }
}
