package com.taskpilot.core.status;

import com.taskpilot.core.todo.ProjectProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Human-readable, append-only Markdown log of what the orchestrator did: sessions,
 * task outcomes, stops and environment restarts.
 *
 * <p>The trail is a convenience for people; a failed append is logged and never
 * interrupts orchestration.
 */
@Component
public class StatusTrail {

    private static final Logger log = LoggerFactory.getLogger(StatusTrail.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final Clock clock;

    public StatusTrail(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    @Autowired
    public StatusTrail(ProjectProperties project) {
        this(project.statusPath(), Clock.systemDefaultZone());
    }

    public Path file() {
        return file;
    }

    /** Timestamped paragraph. */
    public void append(String message) {
        write("\n**[" + now() + "]** " + message + "\n");
    }

    /** Markdown heading of the given level (1-6). */
    public void heading(String title, int level) {
        int hashes = Math.max(1, Math.min(6, level));
        write("\n" + "#".repeat(hashes) + " " + title + "\n");
    }

    public void taskStatus(String taskText, String status, String details) {
        var sb = new StringBuilder()
                .append("\n### ").append(now()).append('\n')
                .append("**Task:** ").append(taskText).append('\n')
                .append("**Status:** ").append(status).append('\n');
        if (details != null && !details.isBlank()) {
            sb.append("**Details:** ").append(details).append('\n');
        }
        write(sb.toString());
    }

    public void separator() {
        write("\n---\n");
    }

    private String now() {
        return LocalDateTime.ofInstant(clock.instant(), zone()).format(TIMESTAMP);
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    private synchronized void write(String text) {
        try {
            if (!Files.exists(file)) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(file, """
                        # TaskPilot project status

                        > Maintained automatically by TaskPilot. Created %s.

                        ## History
                        """.formatted(now()), StandardCharsets.UTF_8);
            }
            Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to append to status trail {}: {}", file, e.getMessage(), e);
        }
    }
}
