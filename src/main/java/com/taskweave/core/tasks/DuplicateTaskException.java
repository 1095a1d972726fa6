package com.taskweave.core.tasks;

import com.taskweave.core.TaskweaveException;

/**
 * Raised when a task id is already in use.
 */
public class DuplicateTaskException extends TaskweaveException {

    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("Task already exists: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
