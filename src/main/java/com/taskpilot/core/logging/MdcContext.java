package com.taskpilot.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys used by the orchestrator's log pattern.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setPhase(String phase) {
        MDC.put("phase", phase);
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("phase");
    }

    public static void clear() {
        MDC.remove("sessionId");
        clearTask();
    }
}
