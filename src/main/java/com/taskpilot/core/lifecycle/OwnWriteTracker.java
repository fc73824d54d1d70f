package com.taskpilot.core.lifecycle;

import java.nio.file.Path;

/**
 * Implemented by components that rewrite watched files themselves, so the
 * {@link SourceChangeWatcher} can tell their writes from external edits.
 */
public interface OwnWriteTracker {

    /** @return true if the file's current content is exactly what this component last wrote */
    boolean isOwnWrite(Path file);
}
