package com.taskweave.agents;

import com.taskweave.core.engine.Agent;
import com.taskweave.core.engine.AgentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Returns the task payload unchanged. Useful for smoke tests of the pipeline.
 */
public class EchoAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(EchoAgent.class);

    public static final String AGENT_ID = "echo";

    @Override
    public AgentResult execute(Map<String, Object> payload) {
        log.debug("Echoing payload with {} keys", payload.size());
        return AgentResult.success(payload);
    }
}
