package com.example.jobscheduler.schedule;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A fire time of a job inside a requested range, carrying the job's display data.
 * Never persisted.
 */
@Value
@Builder
public class ProjectedOccurrence {
    UUID jobId;
    String jobName;
    String cronExpression;
    String webhookUrl;
    Instant firesAt;
}
