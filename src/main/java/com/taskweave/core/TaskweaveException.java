package com.taskweave.core;

/**
 * Base type for every error the orchestration core surfaces to its callers.
 */
public abstract class TaskweaveException extends RuntimeException {

    protected TaskweaveException(String message) {
        super(message);
    }

    protected TaskweaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
