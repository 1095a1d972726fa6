package com.taskweave.core.store;

import com.taskweave.core.TaskweaveException;

/**
 * Thrown when the medium behind a {@link TaskStore} fails to read or write.
 */
public class StorageException extends TaskweaveException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
