package com.example.jobscheduler.service.executor;

import lombok.Value;

import java.util.UUID;

/**
 * Result of one execution attempt: whether the engine succeeded, and the run that records it
 */
@Value
public class JobExecutionOutcome {

    boolean succeeded;
    UUID runId;

    public static JobExecutionOutcome success(UUID runId) {
        return new JobExecutionOutcome(true, runId);
    }

    public static JobExecutionOutcome failure(UUID runId) {
        return new JobExecutionOutcome(false, runId);
    }
}
