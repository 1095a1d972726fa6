package com.taskweave.core.scheduler;

import com.taskweave.core.model.ScheduleConfig;
import com.taskweave.core.model.ScheduleKind;

import java.time.Instant;

/**
 * Read-only snapshot of an active scheduled job.
 *
 * @param nextFireAt earliest pending trigger or retry; null when only offline firings remain
 */
public record ScheduledJobView(
    String jobId,
    String agentId,
    int priority,
    ScheduleKind kind,
    ScheduleConfig config,
    Instant nextFireAt,
    int retryCount
) {}
