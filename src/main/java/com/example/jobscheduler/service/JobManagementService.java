package com.example.jobscheduler.service;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.enums.SchedulePreset;
import com.example.jobscheduler.domain.repository.JobRunRepository;
import com.example.jobscheduler.domain.repository.ScheduledJobRepository;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.JobDetailResponse;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.JobRunResponse;
import com.example.jobscheduler.dto.PresetResponse;
import com.example.jobscheduler.exception.InvalidCronExpressionException;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.mapper.JobMapper;
import com.example.jobscheduler.schedule.CronEvaluator;
import com.example.jobscheduler.schedule.RecurrenceCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for managing jobs on behalf of their owner.
 * <p>
 * Provides:
 * - Job creation from a schedule preset or a raw cron expression
 * - Listing and detail with recent runs
 * - Enable/disable and delete
 * <p>
 * Every operation is scoped to the owner; another owner's job behaves as missing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    static final String MISSING_FIELDS_MESSAGE = "Missing required fields: name, prompt, schedule, webhook_url";
    static final String INVALID_TIME_MESSAGE = "Invalid time. Use HH:mm (24-hour format).";
    static final int MAX_RUN_HISTORY = 100;

    private final ScheduledJobRepository jobRepository;
    private final JobRunRepository runRepository;
    private final CronEvaluator cronEvaluator;
    private final JobMapper jobMapper;
    private final JobSchedulerProperties properties;

    // === Job Creation ===

    /**
     * Create a new enabled job for the owner
     *
     * @throws IllegalArgumentException      if a required field is missing or the preset/time is invalid
     * @throws InvalidCronExpressionException if a raw expression does not parse
     */
    @Transactional
    public JobResponse createJob(String ownerEmail, CreateJobRequest request) {
        var hasRawExpression = isPresent(request.getCronExpression());
        if (!isPresent(request.getName()) || !isPresent(request.getPrompt()) || !isPresent(request.getWebhookUrl())
                || (!isPresent(request.getSchedule()) && !hasRawExpression)) {
            throw new IllegalArgumentException(MISSING_FIELDS_MESSAGE);
        }

        var cronExpression = hasRawExpression
                ? resolveRawExpression(request.getCronExpression())
                : resolvePresetExpression(request.getSchedule(), request.getTime());

        var job = ScheduledJob.builder()
                .ownerEmail(ownerEmail)
                .name(request.getName().trim())
                .prompt(request.getPrompt())
                .cronExpression(cronExpression)
                .webhookUrl(request.getWebhookUrl().trim())
                .enabled(true)
                .build();

        job = jobRepository.save(job);
        log.info("Created job {} '{}' for {} with schedule '{}'", job.getId(), job.getName(), ownerEmail, cronExpression);

        return jobMapper.toResponse(job);
    }

    private String resolvePresetExpression(String schedule, String time) {
        var preset = RecurrenceCatalog.normalizePreset(schedule)
                .orElseThrow(() -> new IllegalArgumentException("Invalid schedule preset. Valid: " + validPresetIds()));

        var selectedTime = isPresent(time)
                ? RecurrenceCatalog.normalizeTimeOfDay(time).orElseThrow(() -> new IllegalArgumentException(INVALID_TIME_MESSAGE))
                : RecurrenceCatalog.DEFAULT_TIME;

        return RecurrenceCatalog.buildExpression(preset, selectedTime)
                .orElseThrow(() -> new IllegalArgumentException("Could not build cron expression from provided schedule/time."));
    }

    private String resolveRawExpression(String expression) {
        var trimmed = expression.trim();
        cronEvaluator.validate(trimmed);
        return trimmed;
    }

    // === Job Retrieval ===

    /**
     * Owner's jobs, newest first
     */
    @Transactional(readOnly = true)
    public List<JobResponse> listJobs(String ownerEmail) {
        return jobMapper.toResponseList(jobRepository.findByOwnerEmailOrderByCreatedAtDesc(ownerEmail));
    }

    /**
     * A job with its most recent runs
     */
    @Transactional(readOnly = true)
    public JobDetailResponse getJob(String ownerEmail, UUID jobId) {
        var job = findOwnedJob(ownerEmail, jobId);

        return JobDetailResponse.builder()
                .job(jobMapper.toResponse(job))
                .runs(recentRuns(jobId, properties.getRunHistoryLimit()))
                .build();
    }

    @Transactional(readOnly = true)
    public List<JobRunResponse> getRuns(String ownerEmail, UUID jobId, Integer limit) {
        findOwnedJob(ownerEmail, jobId);

        var effectiveLimit = limit == null ? properties.getRunHistoryLimit() : Math.max(1, Math.min(limit, MAX_RUN_HISTORY));
        return recentRuns(jobId, effectiveLimit);
    }

    private List<JobRunResponse> recentRuns(UUID jobId, int limit) {
        return jobMapper.toRunResponses(runRepository.findByJobIdOrderByStartedAtDesc(jobId, PageRequest.of(0, limit)));
    }

    // === Job Status Management ===

    /**
     * Enable or disable a job
     */
    @Transactional
    public JobResponse toggleJob(String ownerEmail, UUID jobId, boolean enabled) {
        var updated = jobRepository.updateEnabled(jobId, ownerEmail, enabled);
        if (updated == 0) {
            throw new JobNotFoundException(jobId);
        }

        log.info("Job {} {} by {}", jobId, enabled ? "enabled" : "disabled", ownerEmail);
        return jobMapper.toResponse(findOwnedJob(ownerEmail, jobId));
    }

    /**
     * Delete a job and its runs. Deleting a missing job is a no-op.
     */
    @Transactional
    public void deleteJob(String ownerEmail, UUID jobId) {
        var deleted = jobRepository.deleteByIdAndOwner(jobId, ownerEmail);
        if (deleted == 0) {
            log.debug("Delete of job {} by {} matched nothing", jobId, ownerEmail);
            return;
        }
        log.info("Deleted job {} for {}", jobId, ownerEmail);
    }

    // === Presets ===

    public PresetResponse getPresets() {
        var presets = Arrays.stream(SchedulePreset.values())
                .map(preset -> new PresetResponse.Preset(preset.getId(), preset.getLabel()))
                .toList();

        return PresetResponse.builder()
                .presets(presets)
                .defaultTime(RecurrenceCatalog.DEFAULT_TIME)
                .build();
    }

    private ScheduledJob findOwnedJob(String ownerEmail, UUID jobId) {
        return jobRepository.findByIdAndOwnerEmail(jobId, ownerEmail)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private static String validPresetIds() {
        return Arrays.stream(SchedulePreset.values())
                .map(SchedulePreset::getId)
                .collect(Collectors.joining(", "));
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
