package com.taskpilot.core.lifecycle;

/**
 * Thrown by the orchestration loop after it has closed its session because a reload
 * became due. The owner restarts the loop with fresh sources.
 */
public class ReloadRequestedException extends RuntimeException {

    public ReloadRequestedException(String message) {
        super(message);
    }
}
