package com.taskweave.core.tasks;

import com.taskweave.core.TaskweaveException;
import com.taskweave.core.model.TaskState;

/**
 * Raised when an operation would move a task along a transition the state
 * machine does not allow.
 */
public class IllegalTaskStateException extends TaskweaveException {

    private final String taskId;
    private final TaskState from;
    private final TaskState to;

    public IllegalTaskStateException(String taskId, TaskState from, TaskState to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getFrom() {
        return from;
    }

    public TaskState getTo() {
        return to;
    }
}
