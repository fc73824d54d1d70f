package com.taskpilot.core.verification;

import com.taskpilot.core.model.Verdict;

/**
 * Gate between a received result and a completed task.
 */
public interface ResultVerifier {

    Verdict verify(String taskText, String content);
}
