package com.example.jobscheduler.controller;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.dto.SweepReport;
import com.example.jobscheduler.exception.UnauthorizedTriggerException;
import com.example.jobscheduler.service.executor.BatchRunnerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;

/**
 * Entry point for the external periodic caller that drives sweeps.
 * <p>
 * There is no in-process timer: each authenticated request runs exactly one sweep.
 * The response is the bare sweep report.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/cron")
@Tag(name = "Sweep Trigger", description = "Runs due jobs; called by an external scheduler")
public class CronTriggerController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final BatchRunnerService batchRunnerService;
    private final JobSchedulerProperties properties;
    private final Clock clock;

    @RequestMapping(value = "/execute", method = {RequestMethod.GET, RequestMethod.POST})
    @Operation(summary = "Run due jobs", description = "Requires Authorization: Bearer <cron secret>")
    public ResponseEntity<SweepReport> execute(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (!isAuthorized(authorization)) {
            throw new UnauthorizedTriggerException();
        }

        return ResponseEntity.ok(batchRunnerService.runDueSchedules(clock.instant()));
    }

    private boolean isAuthorized(String authorization) {
        var secret = properties.getCronSecret();
        if (secret == null || secret.isBlank() || authorization == null) {
            return false;
        }

        var expected = (BEARER_PREFIX + secret).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, authorization.getBytes(StandardCharsets.UTF_8));
    }
}
