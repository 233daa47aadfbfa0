package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a run record
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunResponse {

    private UUID id;
    private UUID jobId;
    private Instant startedAt;
    private Instant finishedAt;
    private RunStatus status;
    private String resultSummary;
    private String error;
    private Integer webhookStatus;
}
