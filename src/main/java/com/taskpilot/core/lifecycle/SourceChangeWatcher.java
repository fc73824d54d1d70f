package com.taskpilot.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Background watcher that turns external edits of the TODO file (or any other watched
 * path) into reload requests. It only ever touches {@link LifecycleFlags}.
 */
public class SourceChangeWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SourceChangeWatcher.class);

    private final LifecycleFlags flags;
    private final List<OwnWriteTracker> trackers;
    private final long debounceMillis;

    private final Set<Path> watchedFiles = new HashSet<>();
    private final Set<Path> watchedTrees = new HashSet<>();
    private final Map<WatchKey, Path> keys = new HashMap<>();

    private WatchService watchService;
    private Thread thread;
    private volatile long lastRequestMillis;

    public SourceChangeWatcher(LifecycleFlags flags, List<Path> paths, List<OwnWriteTracker> trackers,
                               long debounceMillis) {
        this.flags = flags;
        this.trackers = List.copyOf(trackers);
        this.debounceMillis = debounceMillis;
        for (Path p : paths) {
            Path abs = p.toAbsolutePath().normalize();
            if (Files.isDirectory(abs)) {
                watchedTrees.add(abs);
            } else {
                watchedFiles.add(abs);
            }
        }
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            for (Path file : watchedFiles) {
                Path dir = file.getParent();
                Files.createDirectories(dir);
                register(dir);
            }
            for (Path tree : watchedTrees) {
                try (Stream<Path> dirs = Files.walk(tree)) {
                    for (Path dir : dirs.filter(Files::isDirectory).toList()) {
                        register(dir);
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot start source-change watcher", e);
        }
        thread = new Thread(this::run, "source-change-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} file(s) and {} director(ies) for changes", watchedFiles.size(), watchedTrees.size());
    }

    private void register(Path dir) throws IOException {
        WatchKey key = dir.register(watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY,
                StandardWatchEventKinds.ENTRY_DELETE);
        keys.put(key, dir);
    }

    private void run() {
        while (true) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = keys.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW || dir == null) {
                    continue;
                }
                Path changed = dir.resolve((Path) event.context());
                onChange(changed);
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    void onChange(Path changed) {
        if (!isWatched(changed) || changed.getFileName().toString().endsWith(".tmp")) {
            return;
        }
        for (OwnWriteTracker tracker : trackers) {
            if (tracker.isOwnWrite(changed)) {
                log.debug("Ignoring own write to {}", changed);
                return;
            }
        }
        long now = System.currentTimeMillis();
        if (now - lastRequestMillis < debounceMillis) {
            return;
        }
        lastRequestMillis = now;
        log.info("Detected change in {}", changed);
        flags.requestReload("watcher:" + changed.getFileName());
    }

    private boolean isWatched(Path changed) {
        Path abs = changed.toAbsolutePath().normalize();
        if (watchedFiles.contains(abs)) {
            return true;
        }
        return watchedTrees.stream().anyMatch(abs::startsWith);
    }

    @Override
    public synchronized void close() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close watch service: {}", e.getMessage());
            }
        }
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
    }
}
