package com.example.jobscheduler.controller;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.dto.SweepReport;
import com.example.jobscheduler.exception.GlobalExceptionHandler;
import com.example.jobscheduler.service.executor.BatchRunnerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("CronTriggerController Tests")
class CronTriggerControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-03T12:01:00Z");

    @Mock
    private BatchRunnerService batchRunnerService;

    private JobSchedulerProperties properties;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        properties = new JobSchedulerProperties();
        properties.setCronSecret("s3cret");

        var controller = new CronTriggerController(batchRunnerService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should run a sweep for GET and POST with the right secret")
    void shouldRunSweep() throws Exception {
        when(batchRunnerService.runDueSchedules(NOW))
                .thenReturn(SweepReport.builder().checked(3).executed(1).results(List.of()).build());

        mockMvc.perform(get("/api/v1/cron/execute").header(HttpHeaders.AUTHORIZATION, "Bearer s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checked").value(3))
                .andExpect(jsonPath("$.executed").value(1));

        mockMvc.perform(post("/api/v1/cron/execute").header(HttpHeaders.AUTHORIZATION, "Bearer s3cret"))
                .andExpect(status().isOk());

        verify(batchRunnerService, times(2)).runDueSchedules(NOW);
    }

    @Test
    @DisplayName("Should reject a missing or wrong secret")
    void shouldRejectBadSecret() throws Exception {
        mockMvc.perform(get("/api/v1/cron/execute"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/v1/cron/execute").header(HttpHeaders.AUTHORIZATION, "Bearer wrong"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/v1/cron/execute").header(HttpHeaders.AUTHORIZATION, "s3cret"))
                .andExpect(status().isUnauthorized());

        verify(batchRunnerService, never()).runDueSchedules(any());
    }

    @Test
    @DisplayName("Should reject every call while no secret is configured")
    void shouldRejectWhenSecretUnset() throws Exception {
        properties.setCronSecret("");

        mockMvc.perform(get("/api/v1/cron/execute").header(HttpHeaders.AUTHORIZATION, "Bearer "))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(batchRunnerService);
    }
}
