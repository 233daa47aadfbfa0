package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.*;
import com.example.jobscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API controller for job management operations.
 * <p>
 * The caller is identified by the {@value #OWNER_HEADER} header, set by the
 * authenticating gateway in front of this service.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Management", description = "APIs for managing scheduled agent jobs")
public class JobController {

    public static final String OWNER_HEADER = "X-User-Email";

    private final JobManagementService jobManagementService;

    @PostMapping
    @Operation(summary = "Create a job", description = "Create a job from a schedule preset or a cron expression")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<JobResponse>> createJob(
            @RequestHeader(OWNER_HEADER) String ownerEmail,
            @Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create job '{}' for {}", request.getName(), ownerEmail);

        var response = jobManagementService.createJob(ownerEmail, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Job created successfully"));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "List the caller's jobs, newest first")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs(@RequestHeader(OWNER_HEADER) String ownerEmail) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listJobs(ownerEmail)));
    }

    @GetMapping("/presets")
    @Operation(summary = "List schedule presets", description = "Preset ids and labels accepted on job creation")
    public ResponseEntity<ApiResponse<PresetResponse>> getPresets() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getPresets()));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a job with its most recent runs")
    public ResponseEntity<ApiResponse<JobDetailResponse>> getJob(
            @RequestHeader(OWNER_HEADER) String ownerEmail,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(ownerEmail, jobId)));
    }

    @GetMapping("/{jobId}/runs")
    @Operation(summary = "Get run history", description = "Most recent runs of a job, newest first")
    public ResponseEntity<ApiResponse<List<JobRunResponse>>> getRuns(
            @RequestHeader(OWNER_HEADER) String ownerEmail,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Maximum number of runs") @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getRuns(ownerEmail, jobId, limit)));
    }

    @PatchMapping("/{jobId}")
    @Operation(summary = "Enable or disable a job")
    public ResponseEntity<ApiResponse<JobResponse>> toggleJob(
            @RequestHeader(OWNER_HEADER) String ownerEmail,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Valid @RequestBody ToggleJobRequest request) {
        log.info("API: Set job {} enabled={} for {}", jobId, request.getEnabled(), ownerEmail);

        var response = jobManagementService.toggleJob(ownerEmail, jobId, request.getEnabled());
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a job", description = "Delete a job and its run history")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> deleteJob(
            @RequestHeader(OWNER_HEADER) String ownerEmail,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Delete job {} for {}", jobId, ownerEmail);

        jobManagementService.deleteJob(ownerEmail, jobId);
        return ResponseEntity.ok(ApiResponse.success(Map.of("deleted", true)));
    }
}
