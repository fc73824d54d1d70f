package com.taskpilot.core.lifecycle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceChangeWatcherTest {

    @TempDir
    Path tempDir;

    private LifecycleFlags flags;
    private Path todoFile;

    @BeforeEach
    void setUp() throws IOException {
        flags = new LifecycleFlags();
        todoFile = tempDir.resolve("TODO.md");
        Files.writeString(todoFile, "- [ ] a\n");
    }

    @Test
    @DisplayName("change to a watched file requests a reload")
    void watchedChangeRequestsReload() {
        var watcher = new SourceChangeWatcher(flags, List.of(todoFile), List.of(), 0);

        watcher.onChange(todoFile);

        assertTrue(flags.snapshot().shouldReload());
    }

    @Test
    @DisplayName("unwatched files and temp files are ignored")
    void ignoresUnwatchedAndTemp() {
        var watcher = new SourceChangeWatcher(flags, List.of(todoFile), List.of(), 0);

        watcher.onChange(tempDir.resolve("notes.md"));
        watcher.onChange(tempDir.resolve("TODO.md.tmp"));

        assertFalse(flags.snapshot().shouldReload());
    }

    @Test
    @DisplayName("the orchestrator's own writes do not trigger a reload")
    void ignoresOwnWrites() {
        OwnWriteTracker tracker = changed -> changed.equals(todoFile);
        var watcher = new SourceChangeWatcher(flags, List.of(todoFile), List.of(tracker), 0);

        watcher.onChange(todoFile);

        assertFalse(flags.snapshot().shouldReload());
    }

    @Test
    @DisplayName("files below a watched directory count")
    void watchedTree() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src/main"));
        var watcher = new SourceChangeWatcher(flags, List.of(tempDir.resolve("src")), List.of(), 0);

        watcher.onChange(src.resolve("App.java"));

        assertTrue(flags.snapshot().shouldReload());
    }

    @Test
    @DisplayName("bursts within the debounce window collapse into one request")
    void debounce() {
        var watcher = new SourceChangeWatcher(flags, List.of(todoFile), List.of(), 60_000);

        watcher.onChange(todoFile);
        watcher.onChange(todoFile);
        watcher.onChange(todoFile);

        assertEquals(1, flags.snapshot().consecutiveIdleReloadSignals());
    }

    @Test
    @DisplayName("a running watcher picks up an external edit")
    void detectsRealEdit() throws Exception {
        try (var watcher = new SourceChangeWatcher(flags, List.of(todoFile), List.of(), 0)) {
            watcher.start();
            Files.writeString(todoFile, "- [ ] a\n- [ ] b\n");

            long deadline = System.currentTimeMillis() + 15_000;
            while (!flags.snapshot().shouldReload() && System.currentTimeMillis() < deadline) {
                Thread.sleep(100);
            }
        }
        assertTrue(flags.snapshot().shouldReload());
    }
}
