package com.taskpilot.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the TaskPilot CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKPILOT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKPILOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void taskState(String state, String taskId, int attempts, int progress, String text) {
        String color = switch (state) {
            case "completed" -> "fg(green)";
            case "failed" -> "fg(red)";
            case "skipped" -> "fg(magenta)";
            case "in_progress" -> "fg(blue)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-20s @|%s %-12s|@ %-8d %-5d %s", taskId, color, state, attempts, progress,
                truncate(text, 40))));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
