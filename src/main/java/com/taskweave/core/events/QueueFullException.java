package com.taskweave.core.events;

import com.taskweave.core.TaskweaveException;

/**
 * Thrown by {@link EventBus#publish(Event)} when the bounded event queue is at capacity.
 */
public class QueueFullException extends TaskweaveException {
    public QueueFullException(String message) {
        super(message);
    }
}
