package com.example.jobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a job that does not exist or belongs to another owner
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public JobNotFoundException(UUID jobId) {
        this(jobId.toString());
    }
}
