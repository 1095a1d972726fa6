package com.taskweave.core.events;

/**
 * Event type tags published by the orchestration core.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String TASK_SCHEDULED = "task_scheduled";
    public static final String TASK_EXECUTED = "task_executed";
    public static final String TASK_SUBMITTED = "task_submitted";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String TASK_FAILED = "task_failed";
    public static final String TASK_CANCELLED = "task_cancelled";
    public static final String SCHEDULE_CANCELLED = "schedule_cancelled";
}
