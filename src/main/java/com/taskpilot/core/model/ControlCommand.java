package com.taskpilot.core.model;

/**
 * A queue mutation requested through the control surface, applied by the loop between tasks.
 */
public interface ControlCommand {

    record AddTask(String text, boolean atHead) implements ControlCommand {}

    record ClearTasks() implements ControlCommand {}
}
