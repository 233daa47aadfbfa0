package com.example.jobscheduler.config;

import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.repository.ScheduledJobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for monitoring sweeps and job runs.
 * <p>
 * Exposes Prometheus metrics for:
 * - Enabled job count
 * - Sweep duration and size
 * - Run outcomes
 * - Webhook delivery outcomes
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ScheduledJobRepository jobRepository;

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("job_scheduler_enabled_jobs", jobRepository, ScheduledJobRepository::countByEnabledTrue)
                .description("Number of enabled scheduled jobs")
                .register(meterRegistry);
    }

    /**
     * Create a timer sample for a sweep
     */
    public Timer.Sample startSweepTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record a finished sweep
     */
    public void recordSweep(Timer.Sample sample, int checked, int executed) {
        sample.stop(Timer.builder("job_scheduler_sweep_time")
                .description("Duration of one sweep over enabled jobs")
                .register(meterRegistry));
        meterRegistry.counter("job_scheduler_jobs_checked").increment(checked);
        meterRegistry.counter("job_scheduler_jobs_executed").increment(executed);
    }

    /**
     * Record the terminal status of a run
     */
    public void recordRun(RunStatus status) {
        meterRegistry.counter("job_scheduler_runs", "status", status.getCode()).increment();
    }

    /**
     * Record a webhook delivery, status 0 meaning the transport failed
     */
    public void recordWebhookDelivery(int statusCode) {
        String outcome;
        if (statusCode == 0) {
            outcome = "transport_error";
        } else if (statusCode >= 200 && statusCode < 300) {
            outcome = "delivered";
        } else {
            outcome = "rejected";
        }
        meterRegistry.counter("job_scheduler_webhook_deliveries", "outcome", outcome).increment();
    }

    /**
     * Record a job that failed outside the run lifecycle (store failure)
     */
    public void recordJobFailure(String errorType) {
        meterRegistry.counter("job_scheduler_job_failures",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }
}
