package com.taskpilot.core.result;

import com.taskpilot.core.model.ResultWaitOutcome;
import com.taskpilot.core.model.ResultWaitRequest;

import java.nio.file.Path;

/**
 * Content exchange with the external agent: instructions go out as artifacts,
 * results come back as artifacts.
 */
public interface ResultChannel {

    /**
     * Makes the instruction text available to the agent.
     *
     * @return where the instruction was written
     */
    Path publishInstruction(String taskId, int instructionNumber, String text);

    /**
     * Blocks until a candidate artifact is complete or the request's timeout elapses.
     * Never throws on timeout; returns {@code success=false} instead.
     */
    ResultWaitOutcome await(ResultWaitRequest request);
}
