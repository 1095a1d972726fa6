package com.taskweave.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskweave-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";
    public static final String JOB_ID = "jobId";

    private MdcContext() {}

    public static void setTask(String taskId, String agentId) {
        MDC.put(TASK_ID, taskId);
        MDC.put(AGENT_ID, agentId);
    }

    public static void setJob(String jobId) {
        MDC.put(JOB_ID, jobId);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ID);
        MDC.remove(JOB_ID);
    }
}
