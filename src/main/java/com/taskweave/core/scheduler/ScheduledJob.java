package com.taskweave.core.scheduler;

import com.taskweave.core.model.ScheduleConfig;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Runtime binding of a schedule to the task it materializes on every fire.
 * Mutable fields are guarded by the owning {@link JobScheduler}'s lock.
 */
final class ScheduledJob {

    private final String jobId;
    private final Map<String, Object> payload;
    private final String agentId;
    private final int priority;
    private final ScheduleConfig config;
    private final ScheduleTrigger trigger;

    private int sequence;
    private int retryCount;
    private volatile boolean cancelled;

    ScheduledFuture<?> nextTrigger;
    Instant nextFireAt;

    // keyed by firing sequence; overlapping firings of one job retry independently
    private final Map<Integer, PendingRetry> pendingRetries = new TreeMap<>();

    ScheduledJob(String jobId, Map<String, Object> payload, String agentId, int priority,
                 ScheduleConfig config, ScheduleTrigger trigger) {
        this.jobId = jobId;
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.agentId = agentId;
        this.priority = priority;
        this.config = config;
        this.trigger = trigger;
    }

    String jobId() { return jobId; }
    Map<String, Object> payload() { return payload; }
    String agentId() { return agentId; }
    int priority() { return priority; }
    ScheduleConfig config() { return config; }
    ScheduleTrigger trigger() { return trigger; }

    int nextSequence() {
        return ++sequence;
    }

    int retryCount() { return retryCount; }

    /**
     * Count one more retry if the budget allows it.
     */
    boolean tryConsumeRetry() {
        if (!config.retryOnFailure() || retryCount >= config.maxRetries()) {
            return false;
        }
        retryCount++;
        return true;
    }

    void resetRetries() {
        retryCount = 0;
    }

    void addRetry(int firingSequence, ScheduledFuture<?> handle, Instant at) {
        pendingRetries.put(firingSequence, new PendingRetry(handle, at));
    }

    void clearRetry(int firingSequence) {
        pendingRetries.remove(firingSequence);
    }

    /**
     * Earliest instant a pending retry fires, or null when none is armed.
     */
    Instant earliestRetryAt() {
        return pendingRetries.values().stream()
                .map(PendingRetry::at)
                .min(Instant::compareTo)
                .orElse(null);
    }

    boolean isCancelled() { return cancelled; }

    void cancel() {
        cancelled = true;
        if (nextTrigger != null) {
            nextTrigger.cancel(false);
            nextTrigger = null;
        }
        pendingRetries.values().forEach(r -> r.handle().cancel(false));
        pendingRetries.clear();
        nextFireAt = null;
    }

    boolean isExhausted() {
        return nextTrigger == null && pendingRetries.isEmpty();
    }

    String taskIdFor(int firingSequence) {
        return jobId + "#" + firingSequence;
    }

    private record PendingRetry(ScheduledFuture<?> handle, Instant at) {}
}
