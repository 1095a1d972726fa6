package com.taskweave.core.scheduler;

import com.taskweave.core.TaskweaveException;

/**
 * Raised when a {@link com.taskweave.core.model.ScheduleConfig} does not describe
 * a usable trigger for its kind.
 */
public class InvalidScheduleException extends TaskweaveException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
