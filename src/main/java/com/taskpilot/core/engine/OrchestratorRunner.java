package com.taskpilot.core.engine;

import com.taskpilot.core.lifecycle.LifecycleFlags;
import com.taskpilot.core.lifecycle.OwnWriteTracker;
import com.taskpilot.core.lifecycle.ReloadRequestedException;
import com.taskpilot.core.lifecycle.SourceChangeWatcher;
import com.taskpilot.core.lifecycle.WatchProperties;
import com.taskpilot.core.todo.ProjectProperties;
import com.taskpilot.core.todo.TodoSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import java.nio.file.Path;

/**
 * Owns the orchestration loop: starts the source-change watcher, runs sessions back to
 * back across reloads, and turns the final stop into a process exit code.
 */
@Service
public class OrchestratorRunner {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorRunner.class);

    private final OrchestrationLoop loop;
    private final TodoSource todo;
    private final LifecycleFlags flags;
    private final ProjectProperties project;
    private final WatchProperties watchProperties;
    private final LoopProperties loopProperties;
    private final ObjectProvider<OwnWriteTracker> trackers;
    private final Clock clock = Clock.systemDefaultZone();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CountDownLatch finished = new CountDownLatch(0);

    public OrchestratorRunner(OrchestrationLoop loop, @Lazy TodoSource todo, LifecycleFlags flags,
                              ProjectProperties project, WatchProperties watchProperties,
                              LoopProperties loopProperties, ObjectProvider<OwnWriteTracker> trackers) {
        this.loop = loop;
        this.todo = todo;
        this.flags = flags;
        this.project = project;
        this.watchProperties = watchProperties;
        this.loopProperties = loopProperties;
        this.trackers = trackers;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs sessions on the calling thread until a stop.
     *
     * @return 0 after an orderly stop, 1 after a critical one
     */
    public int run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Orchestrator is already running");
        }
        finished = new CountDownLatch(1);
        try (SourceChangeWatcher watcher = startWatcher()) {
            while (true) {
                String sessionId = TaskIds.newSessionId(clock);
                try {
                    boolean clean = loop.run(sessionId);
                    log.info("Orchestrator stopped ({})", clean ? "clean" : "critical");
                    return clean ? 0 : 1;
                } catch (ReloadRequestedException e) {
                    log.info("Restarting orchestration: {}", e.getMessage());
                    todo.reload();
                }
            }
        } finally {
            running.set(false);
            finished.countDown();
        }
    }

    /**
     * Runs on a dedicated non-daemon thread; {@code onExit} receives the exit code.
     */
    public Thread startInBackground(IntConsumer onExit) {
        Thread thread = new Thread(() -> {
            int code;
            try {
                code = run();
            } catch (RuntimeException e) {
                log.error("Orchestrator failed", e);
                code = 1;
            }
            onExit.accept(code);
        }, "orchestrator");
        thread.start();
        return thread;
    }

    @PreDestroy
    public void shutdown() {
        if (!running.get()) {
            return;
        }
        flags.requestStop("shutdown", false);
        try {
            if (!finished.await(loopProperties.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Orchestrator did not reach a safe point within {}s",
                        loopProperties.getShutdownGrace().toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private SourceChangeWatcher startWatcher() {
        if (!watchProperties.isEnabled()) {
            return null;
        }
        List<Path> paths = new ArrayList<>();
        paths.add(project.todoPath());
        for (String extra : watchProperties.getPaths()) {
            paths.add(project.resolve(extra));
        }
        var watcher = new SourceChangeWatcher(flags, paths, trackers.orderedStream().toList(),
                watchProperties.getDebounceMillis());
        watcher.start();
        return watcher;
    }
}
