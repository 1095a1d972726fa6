package com.taskweave.core.tasks;

import com.taskweave.core.TaskweaveException;

public class TaskNotFoundException extends TaskweaveException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
