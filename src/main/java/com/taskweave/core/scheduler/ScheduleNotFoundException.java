package com.taskweave.core.scheduler;

import com.taskweave.core.TaskweaveException;

public class ScheduleNotFoundException extends TaskweaveException {

    private final String jobId;

    public ScheduleNotFoundException(String jobId) {
        super("No scheduled job: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
