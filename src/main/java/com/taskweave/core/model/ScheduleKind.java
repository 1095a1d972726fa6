package com.taskweave.core.model;

/**
 * How a scheduled job decides when to fire.
 */
public enum ScheduleKind {
    ONE_TIME,
    RECURRING,
    CRON
}
