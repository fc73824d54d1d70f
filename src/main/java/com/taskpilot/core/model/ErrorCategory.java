package com.taskpilot.core.model;

/**
 * Classification of an agent failure.
 */
public enum ErrorCategory {
    CRITICAL,     // account/credentials permanently unusable; never retried
    RECOVERABLE,  // execution backend broken in a restart-fixable way
    TRANSIENT
}
