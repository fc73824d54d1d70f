package com.taskpilot.agent;

import java.nio.file.Path;
import java.util.List;

/**
 * Expands {instruction}, {instruction_file} and {task_id} inside a configured command line.
 * Each placeholder expands within its own argument, so instruction text is never split.
 */
final class CommandLineTemplate {

    private CommandLineTemplate() {}

    static List<String> expand(List<String> template, AgentRequest request, Path instructionFile) {
        String file = instructionFile != null ? instructionFile.toString() : "";
        return template.stream()
                .map(arg -> arg
                        .replace("{instruction_file}", file)
                        .replace("{instruction}", request.instruction())
                        .replace("{task_id}", request.taskId()))
                .toList();
    }
}
