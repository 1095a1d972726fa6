package com.taskweave.core.engine;

import java.time.Duration;
import java.time.Instant;

/**
 * Activity summary of a registered agent.
 *
 * @param timeout      per-agent execution timeout, null when the default applies
 * @param lastActivity when the agent last finished a task (nullable)
 */
public record AgentStatus(
    String agentId,
    Duration timeout,
    int completed,
    int failed,
    Instant lastActivity
) {}
