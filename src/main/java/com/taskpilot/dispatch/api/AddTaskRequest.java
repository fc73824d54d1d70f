package com.taskpilot.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/control/tasks.
 *
 * @param text     task text as it should appear in the TODO list
 * @param position "head" or "tail"; nullable, defaults to tail
 */
public record AddTaskRequest(
    String text,
    String position
) {}
