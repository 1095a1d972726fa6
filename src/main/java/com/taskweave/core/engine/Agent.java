package com.taskweave.core.engine;

import java.util.Map;

/**
 * Pluggable executor for the tasks routed to it by agent id.
 * Implementations must be safe to call from several worker threads at once.
 */
@FunctionalInterface
public interface Agent {

    /**
     * Run one task. Throwing is equivalent to returning {@link AgentResult#failure(String)}
     * with the exception message.
     */
    AgentResult execute(Map<String, Object> payload) throws Exception;
}
