package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.EngineProperties;
import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.JobRun;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.repository.JobRunRepository;
import com.example.jobscheduler.domain.repository.ScheduledJobRepository;
import com.example.jobscheduler.exception.EngineInvocationException;
import com.example.jobscheduler.service.alert.SlackAlertService;
import com.example.jobscheduler.service.engine.AgentToolset;
import com.example.jobscheduler.service.engine.EngineRequest;
import com.example.jobscheduler.service.engine.EngineResult;
import com.example.jobscheduler.service.engine.TaskExecutionEngine;
import com.example.jobscheduler.service.webhook.WebhookClient;
import com.example.jobscheduler.service.webhook.WebhookPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Service responsible for executing a single scheduled job.
 * <p>
 * Steps, strictly in order:
 * 1. Open a RUNNING run (a store failure here aborts the attempt)
 * 2. Invoke the task execution engine with the owner's toolset
 * 3. Deliver the result to the job's webhook, once
 * 4. Close the run as COMPLETED with a truncated summary and the webhook status
 * 5. Advance the job's last-run marker to the attempt's start
 * <p>
 * A failure in steps 2 or 3, including an engine that returns no result, closes the run
 * as FAILED instead of step 4. Errors writing the closed run still propagate. Step 5 runs
 * whenever a run was opened, so a failing job is not retried until its next fire time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutorService {

    static final String TRUNCATION_MARKER = "...";
    static final String UNKNOWN_ERROR = "Unknown error";

    private final ScheduledJobRepository jobRepository;
    private final JobRunRepository runRepository;
    private final TaskExecutionEngine executionEngine;
    private final AgentToolset agentToolset;
    private final WebhookClient webhookClient;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final JobSchedulerProperties properties;
    private final EngineProperties engineProperties;
    private final Clock clock;

    /**
     * Execute a job once.
     *
     * @param job the job to execute
     * @return whether the engine succeeded, and the id of the run recording the attempt
     */
    public JobExecutionOutcome execute(ScheduledJob job) {
        var startedAt = clock.instant();
        var run = openRun(job, startedAt);

        log.info("Started run {} of job {} ({})", run.getId(), job.getId(), job.getName());

        try {
            String summary;
            int webhookStatus;
            try {
                var result = executionEngine.invoke(buildEngineRequest(job));
                if (result == null) {
                    throw new EngineInvocationException("Engine returned no result");
                }
                webhookStatus = deliverResult(job, result);
                summary = summarize(result.getText(), properties.getSummaryMaxLength());
            } catch (Exception e) {
                handleEngineFailure(job, run, e);
                return JobExecutionOutcome.failure(run.getId());
            }

            handleSuccess(run, summary, webhookStatus);
            return JobExecutionOutcome.success(run.getId());
        } finally {
            advanceLastRun(job, startedAt);
        }
    }

    private JobRun openRun(ScheduledJob job, Instant startedAt) {
        var run = JobRun.builder()
                .jobId(job.getId())
                .startedAt(startedAt)
                .status(RunStatus.RUNNING)
                .build();

        return runRepository.save(run);
    }

    private EngineRequest buildEngineRequest(ScheduledJob job) {
        return EngineRequest.builder()
                .prompt(job.getPrompt())
                .ownerEmail(job.getOwnerEmail())
                .systemInstruction(engineProperties.getSystemInstruction())
                .tools(agentToolset.forOwner(job.getOwnerEmail()))
                .maxSteps(engineProperties.getMaxSteps())
                .build();
    }

    private int deliverResult(ScheduledJob job, EngineResult result) {
        var payload = WebhookPayload.builder()
                .jobName(job.getName())
                .prompt(job.getPrompt())
                .response(result.getText())
                .executedAt(clock.instant().toString())
                .toolsUsed(result.toolsUsed())
                .build();

        var status = webhookClient.post(job.getWebhookUrl(), payload);
        metricsConfig.recordWebhookDelivery(status);
        return status;
    }

    private void handleSuccess(JobRun run, String summary, int webhookStatus) {
        run.complete(clock.instant(), summary, webhookStatus);
        runRepository.save(run);
        metricsConfig.recordRun(RunStatus.COMPLETED);

        log.info("Run {} completed, webhook status {}", run.getId(), webhookStatus);
    }

    private void handleEngineFailure(ScheduledJob job, JobRun run, Exception e) {
        var error = e.getMessage() != null ? e.getMessage() : UNKNOWN_ERROR;
        log.warn("Run {} of job {} failed: {}", run.getId(), job.getId(), error);

        run.fail(clock.instant(), error);
        runRepository.save(run);
        metricsConfig.recordRun(RunStatus.FAILED);

        slackAlertService.sendRunFailureAlert(job, run);
    }

    private void advanceLastRun(ScheduledJob job, Instant startedAt) {
        var updated = jobRepository.updateLastRunAt(job.getId(), startedAt);
        if (updated == 0) {
            log.warn("Job {} disappeared before its last run could be recorded", job.getId());
            return;
        }
        job.setLastRunAt(startedAt);
    }

    /**
     * Truncate a result to {@code maxLength} characters, marking the cut
     */
    static String summarize(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + TRUNCATION_MARKER;
    }
}
