package com.taskweave.core.engine;

import java.util.Map;

/**
 * What the orchestrator knows about one task's latest execution.
 *
 * @param taskId  task identifier
 * @param phase   where the execution stands
 * @param context agent id, task state and timing while the execution is in flight
 * @param result  agent output when {@link Phase#COMPLETED}
 * @param error   failure message when {@link Phase#FAILED}
 */
public record ExecutionStatus(
    String taskId,
    Phase phase,
    Map<String, Object> context,
    Object result,
    String error
) {

    public enum Phase {
        NOT_FOUND,
        RUNNING,
        COMPLETED,
        FAILED
    }

    public static ExecutionStatus notFound(String taskId) {
        return new ExecutionStatus(taskId, Phase.NOT_FOUND, Map.of(), null, null);
    }

    public static ExecutionStatus running(String taskId, Map<String, Object> context) {
        return new ExecutionStatus(taskId, Phase.RUNNING, context, null, null);
    }

    public static ExecutionStatus completed(String taskId, Object result) {
        return new ExecutionStatus(taskId, Phase.COMPLETED, Map.of(), result, null);
    }

    public static ExecutionStatus failed(String taskId, String error) {
        return new ExecutionStatus(taskId, Phase.FAILED, Map.of(), null, error);
    }
}
