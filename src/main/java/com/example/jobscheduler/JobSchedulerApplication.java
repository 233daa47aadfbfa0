package com.example.jobscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Agent Job Scheduler Application
 * <p>
 * Runs natural-language agent prompts on cron-like recurrence schedules.
 * <p>
 * Features:
 * - Preset-based schedule creation with human-readable descriptions
 * - Due-detection driven by an external periodic trigger
 * - One execution attempt per occurrence, no retries, append-only run history
 * - Best-effort webhook delivery of each run's result
 * - Side-effect free occurrence projection for calendar views
 */
@SpringBootApplication
public class JobSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobSchedulerApplication.class, args);
    }
}
