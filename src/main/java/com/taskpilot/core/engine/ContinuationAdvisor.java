package com.taskpilot.core.engine;

import com.taskpilot.core.model.TaskRecord;

/**
 * Decides whether a partially completed task resumes now or moves to the end of the pass.
 */
public interface ContinuationAdvisor {

    enum Advice { CONTINUE, POSTPONE }

    Advice advise(TaskRecord partial);
}
