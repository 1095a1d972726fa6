package com.taskweave.core.scheduler;

import com.taskweave.core.model.Task;

/**
 * Where scheduled firings hand their materialized tasks.
 */
public interface ExecutionGateway {

    /**
     * Hand a task over for execution. Returns once the hand-off is accepted;
     * the execution outcome is reported elsewhere.
     */
    void submit(Task task);

    /**
     * Whether {@link #submit} can currently accept work. Firings made while this
     * is false are kept aside until {@link JobScheduler#drainOffline()} succeeds.
     */
    boolean isReachable();
}
