package com.taskweave.core.engine;

/**
 * Outcome of one {@link Agent} invocation.
 *
 * @param success whether the agent finished the task
 * @param result  agent output on success (nullable)
 * @param error   failure message (null on success)
 */
public record AgentResult(boolean success, Object result, String error) {

    public static AgentResult success(Object result) {
        return new AgentResult(true, result, null);
    }

    public static AgentResult failure(String error) {
        return new AgentResult(false, null, error == null ? "unknown error" : error);
    }
}
