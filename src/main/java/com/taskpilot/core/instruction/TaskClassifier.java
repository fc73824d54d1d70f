package com.taskpilot.core.instruction;

/**
 * Picks the instruction-template category for a task.
 */
public interface TaskClassifier {

    String categoryOf(String taskText);
}
