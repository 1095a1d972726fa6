package com.taskweave.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Describes when a scheduled job fires and how failed firings are retried.
 * Exactly one of {@code startAt} (one-time), {@code interval} (recurring) or
 * {@code cronExpression} (cron) is required, matching {@code kind}; for recurring
 * and cron schedules {@code startAt} / {@code endAt} act as optional bounds.
 *
 * @param kind           trigger kind
 * @param startAt        first fire (one-time) or lower bound (nullable)
 * @param endAt          upper bound, no fire happens after it (nullable)
 * @param interval       period of a recurring schedule (nullable)
 * @param cronExpression crontab expression of a cron schedule (nullable)
 * @param retryOnFailure re-arm a failed firing after {@code retryDelay}
 * @param maxRetries     retry budget per job
 * @param retryDelay     delay before a retry firing
 */
public record ScheduleConfig(
    ScheduleKind kind,
    Instant startAt,
    Instant endAt,
    Duration interval,
    String cronExpression,
    boolean retryOnFailure,
    int maxRetries,
    Duration retryDelay
) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMinutes(5);

    public static ScheduleConfig oneTime(Instant startAt) {
        return new ScheduleConfig(ScheduleKind.ONE_TIME, startAt, null, null, null,
                true, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
    }

    public static ScheduleConfig recurring(Duration interval) {
        return new ScheduleConfig(ScheduleKind.RECURRING, null, null, interval, null,
                true, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
    }

    public static ScheduleConfig cron(String cronExpression) {
        return new ScheduleConfig(ScheduleKind.CRON, null, null, null, cronExpression,
                true, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
    }

    public ScheduleConfig between(Instant start, Instant end) {
        return new ScheduleConfig(kind, start, end, interval, cronExpression,
                retryOnFailure, maxRetries, retryDelay);
    }

    public ScheduleConfig withRetry(boolean retry, int retries, Duration delay) {
        return new ScheduleConfig(kind, startAt, endAt, interval, cronExpression,
                retry, retries, delay);
    }
}
