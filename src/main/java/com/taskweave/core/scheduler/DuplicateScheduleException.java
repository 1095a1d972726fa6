package com.taskweave.core.scheduler;

import com.taskweave.core.TaskweaveException;

public class DuplicateScheduleException extends TaskweaveException {

    private final String jobId;

    public DuplicateScheduleException(String jobId) {
        super("Job already scheduled: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
