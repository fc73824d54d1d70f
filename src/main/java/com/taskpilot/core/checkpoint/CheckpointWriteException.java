package com.taskpilot.core.checkpoint;

/**
 * The ledger could not be persisted. Fatal to the enclosing operation.
 */
public class CheckpointWriteException extends RuntimeException {

    public CheckpointWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
