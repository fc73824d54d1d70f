package com.taskpilot.core.model;

/**
 * Normalized outcome of one external-agent call.
 *
 * @param success      true when the agent exited with code 0
 * @param stdout       captured standard output
 * @param stderr       captured standard error
 * @param returnCode   process exit code, -1 when the process never produced one
 * @param errorMessage human-readable failure description, null on success
 * @param elapsedMs    wall-clock time spent in the call
 */
public record InvocationResult(
    boolean success,
    String stdout,
    String stderr,
    int returnCode,
    String errorMessage,
    long elapsedMs
) {

    public static InvocationResult failure(String errorMessage, long elapsedMs) {
        return new InvocationResult(false, "", "", -1, errorMessage, elapsedMs);
    }
}
