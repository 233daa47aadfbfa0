package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary of one sweep over enabled jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepReport {

    /**
     * Enabled jobs considered
     */
    private int checked;

    /**
     * Due jobs dispatched
     */
    private int executed;

    /**
     * One entry per due job, in load order
     */
    private List<SweepResult> results;
}
