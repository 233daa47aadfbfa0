package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.repository.ScheduledJobRepository;
import com.example.jobscheduler.dto.SweepReport;
import com.example.jobscheduler.dto.SweepResult;
import com.example.jobscheduler.schedule.DueDetector;
import com.example.jobscheduler.service.alert.SlackAlertService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Service responsible for sweeping enabled jobs and executing the due ones.
 * <p>
 * Flow:
 * 1. Load all enabled jobs
 * 2. Keep the jobs the due-detector reports as due at {@code now}
 * 3. Dispatch each due job to the sweep executor
 * 4. Wait for all of them and collect one result per job, in load order
 * <p>
 * Sweeps are stateless and not coordinated with each other. Two overlapping sweeps
 * can both see a job as due before either advances its last-run marker.
 */
@Slf4j
@Service
public class BatchRunnerService {

    private final ScheduledJobRepository jobRepository;
    private final DueDetector dueDetector;
    private final JobExecutorService jobExecutorService;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final ExecutorService sweepExecutor;

    public BatchRunnerService(ScheduledJobRepository jobRepository, DueDetector dueDetector, JobExecutorService jobExecutorService,
                              SlackAlertService slackAlertService, MetricsConfig metricsConfig,
                              @Qualifier("sweepExecutor") ExecutorService sweepExecutor) {
        this.jobRepository = jobRepository;
        this.dueDetector = dueDetector;
        this.jobExecutorService = jobExecutorService;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.sweepExecutor = sweepExecutor;
    }

    /**
     * Run every enabled job that is due at {@code now}.
     * A failure in one job never prevents the others from running.
     */
    public SweepReport runDueSchedules(Instant now) {
        var sample = metricsConfig.startSweepTimer();

        var jobs = jobRepository.findByEnabledTrueOrderByCreatedAtAsc();
        var dueJobs = jobs.stream()
                .filter(job -> dueDetector.isDue(job.getCronExpression(), job.getLastRunAt(), now))
                .toList();

        log.info("Sweep at {}: {} enabled jobs, {} due", now, jobs.size(), dueJobs.size());

        var futures = dueJobs.stream()
                .map(job -> CompletableFuture.supplyAsync(() -> processJob(job), sweepExecutor))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        var results = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        var succeeded = results.stream().filter(SweepResult::isSuccess).count();
        log.info("Sweep finished: {} executed, {} successful", results.size(), succeeded);

        metricsConfig.recordSweep(sample, jobs.size(), dueJobs.size());

        return SweepReport.builder()
                .checked(jobs.size())
                .executed(dueJobs.size())
                .results(results)
                .build();
    }

    private SweepResult processJob(ScheduledJob job) {
        try {
            var outcome = jobExecutorService.execute(job);
            return SweepResult.builder()
                    .jobId(job.getId())
                    .name(job.getName())
                    .success(outcome.isSucceeded())
                    .runId(outcome.getRunId())
                    .build();
        } catch (Exception e) {
            log.error("Error processing job {}: {}", job.getId(), e.getMessage(), e);
            metricsConfig.recordJobFailure(e.getClass().getSimpleName());
            slackAlertService.sendErrorAlert("Scheduled Job Failed", "Job " + job.getName() + " (" + job.getId() + ") failed during a sweep", e.getMessage());

            return SweepResult.builder()
                    .jobId(job.getId())
                    .name(job.getName())
                    .success(false)
                    .error(e.getMessage() != null ? e.getMessage() : JobExecutorService.UNKNOWN_ERROR)
                    .build();
        }
    }
}
