package com.taskweave.core.events;

/**
 * Advisory priority of an {@link Event}. Delivery stays FIFO regardless of it.
 */
public enum EventPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
