package com.taskweave.core.model;

/**
 * Queue a task is placed in, derived from its integer priority.
 * Values are declared in dequeue order.
 */
public enum PriorityClass {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Maps an integer priority: anything above 1 is HIGH, anything below 1 is LOW,
     * exactly 1 is MEDIUM.
     */
    public static PriorityClass of(int priority) {
        if (priority > 1) return HIGH;
        if (priority < 1) return LOW;
        return MEDIUM;
    }
}
