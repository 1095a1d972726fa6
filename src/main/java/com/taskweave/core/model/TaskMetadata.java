package com.taskweave.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Bookkeeping attached to every task.
 *
 * @param createdAt  when the task was created
 * @param updatedAt  last state change
 * @param retries    failed attempts that were re-enqueued so far
 * @param maxRetries re-enqueue budget before a failure becomes terminal
 * @param lastError  message of the most recent failure (nullable)
 */
public record TaskMetadata(
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("retries") int retries,
    @JsonProperty("max_retries") int maxRetries,
    @JsonProperty("last_error") String lastError
) {

    public static TaskMetadata initial(Instant now, int maxRetries) {
        return new TaskMetadata(now, now, 0, maxRetries, null);
    }

    public TaskMetadata touched(Instant now) {
        return new TaskMetadata(createdAt, now, retries, maxRetries, lastError);
    }

    public TaskMetadata withError(String error, Instant now) {
        return new TaskMetadata(createdAt, now, retries, maxRetries, error);
    }

    public TaskMetadata withRetry(Instant now) {
        return new TaskMetadata(createdAt, now, retries + 1, maxRetries, lastError);
    }

    public boolean retriesRemaining() {
        return retries < maxRetries;
    }
}
