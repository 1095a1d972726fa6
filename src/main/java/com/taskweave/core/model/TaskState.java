package com.taskweave.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a {@link Task}.
 */
public enum TaskState {
    PENDING,    // waiting in its priority queue
    QUEUED,     // handed to the worker pool, not started yet
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Whether the state machine allows moving from this state to {@code target}.
     */
    public boolean canTransitionTo(TaskState target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    private Set<TaskState> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(QUEUED, RUNNING, CANCELLED);
            case QUEUED -> EnumSet.of(RUNNING, PENDING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, PENDING);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
