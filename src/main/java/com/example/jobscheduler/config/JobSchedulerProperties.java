package com.example.jobscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * IANA zone every cron expression is evaluated in
     */
    @NotBlank
    private String timezone = "America/Sao_Paulo";

    /**
     * Shared secret the periodic trigger sends as a bearer token.
     * Sweeps are refused while this is blank.
     */
    private String cronSecret;

    /**
     * Number of due jobs executed concurrently within one sweep (1 = sequential)
     */
    @Min(1)
    private int sweepParallelism = 4;

    /**
     * Upper bound of occurrences projected per job and range
     */
    @Min(1)
    private int maxOccurrences = 40;

    /**
     * Result summary length stored on a run before truncation
     */
    @Min(1)
    private int summaryMaxLength = 500;

    /**
     * Number of runs returned with a job's detail view
     */
    @Min(1)
    private int runHistoryLimit = 10;

    public ZoneId getZoneId() {
        return ZoneId.of(timezone);
    }
}
