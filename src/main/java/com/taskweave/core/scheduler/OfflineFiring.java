package com.taskweave.core.scheduler;

import java.time.Instant;

/**
 * A firing that could not reach the execution layer and waits for
 * {@link JobScheduler#drainOffline()}.
 *
 * @param jobId    job that fired
 * @param taskId   task the firing materializes
 * @param sequence firing number within the job
 * @param firedAt  when the firing happened
 */
public record OfflineFiring(String jobId, String taskId, int sequence, Instant firedAt) {}
