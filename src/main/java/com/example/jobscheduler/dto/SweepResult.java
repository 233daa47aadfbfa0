package com.example.jobscheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Outcome of one due job within a sweep
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SweepResult {

    private UUID jobId;
    private String name;
    private boolean success;

    /**
     * Absent when the job failed before a run could be opened
     */
    private UUID runId;

    private String error;
}
