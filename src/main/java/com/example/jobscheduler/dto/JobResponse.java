package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID id;
    private String ownerEmail;
    private String name;
    private String prompt;
    private String cronExpression;

    /**
     * Human-readable form of the cron expression
     */
    private String scheduleDescription;

    private String webhookUrl;
    private boolean enabled;
    private Instant lastRunAt;
    private Instant createdAt;
}
