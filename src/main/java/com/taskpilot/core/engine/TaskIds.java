package com.taskpilot.core.engine;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifier generation for tasks and sessions.
 */
final class TaskIds {

    private static final DateTimeFormatter SESSION = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final AtomicLong last = new AtomicLong();

    private TaskIds() {}

    /** {@code task_<epochMillis>}, strictly increasing within this JVM. */
    static String nextTaskId(Clock clock) {
        long now = clock.millis();
        long id = last.updateAndGet(prev -> Math.max(prev + 1, now));
        return "task_" + id;
    }

    static String newSessionId(Clock clock) {
        return "session_" + LocalDateTime.now(clock).format(SESSION);
    }
}
