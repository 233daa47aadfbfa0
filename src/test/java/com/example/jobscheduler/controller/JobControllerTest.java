package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.exception.GlobalExceptionHandler;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.service.JobManagementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobController Tests")
class JobControllerTest {

    private static final String OWNER = "owner@example.com";

    @Mock
    private JobManagementService jobManagementService;

    @Captor
    private ArgumentCaptor<CreateJobRequest> requestCaptor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new JobController(jobManagementService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should create a job from snake_case JSON")
    void shouldCreateJob() throws Exception {
        var jobId = UUID.randomUUID();
        when(jobManagementService.createJob(eq(OWNER), requestCaptor.capture()))
                .thenReturn(JobResponse.builder().id(jobId).name("digest").scheduleDescription("Every Monday at 09:00").build());

        mockMvc.perform(post("/api/v1/jobs")
                        .header(JobController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "digest", "prompt": "Summarize", "schedule": "weekly",
                                 "webhook_url": "https://hooks.example.com/digest"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(jobId.toString()))
                .andExpect(jsonPath("$.data.scheduleDescription").value("Every Monday at 09:00"));

        assertThat(requestCaptor.getValue().getWebhookUrl()).isEqualTo("https://hooks.example.com/digest");
    }

    @Test
    @DisplayName("Should map validation failures to 400")
    void shouldReturnBadRequest() throws Exception {
        when(jobManagementService.createJob(eq(OWNER), any()))
                .thenThrow(new IllegalArgumentException("Missing required fields: name, prompt, schedule, webhook_url"));

        mockMvc.perform(post("/api/v1/jobs")
                        .header(JobController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required fields: name, prompt, schedule, webhook_url"));
    }

    @Test
    @DisplayName("Should reject over-long names and webhook URLs with 400")
    void shouldRejectOversizedFields() throws Exception {
        var longName = "n".repeat(201);
        var longUrl = "https://hooks.example.com/" + "p".repeat(2048);

        mockMvc.perform(post("/api/v1/jobs")
                        .header(JobController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "%s", "prompt": "Summarize", "schedule": "weekly",
                                 "webhook_url": "%s"}
                                """.formatted(longName, longUrl)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors.length()").value(2));

        verifyNoInteractions(jobManagementService);
    }

    @Test
    @DisplayName("Should reject calls without an owner")
    void shouldRequireOwner() throws Exception {
        mockMvc.perform(get("/api/v1/jobs"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(jobManagementService);
    }

    @Test
    @DisplayName("Should return 404 for a job that is not the caller's")
    void shouldReturnNotFound() throws Exception {
        var jobId = UUID.randomUUID();
        when(jobManagementService.getJob(OWNER, jobId)).thenThrow(new JobNotFoundException(jobId));

        mockMvc.perform(get("/api/v1/jobs/{jobId}", jobId).header(JobController.OWNER_HEADER, OWNER))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should require a boolean when toggling")
    void shouldRequireEnabledFlag() throws Exception {
        mockMvc.perform(patch("/api/v1/jobs/{jobId}", UUID.randomUUID())
                        .header(JobController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(jobManagementService);
    }

    @Test
    @DisplayName("Should confirm deletion")
    void shouldDelete() throws Exception {
        var jobId = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/jobs/{jobId}", jobId).header(JobController.OWNER_HEADER, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deleted").value(true));

        verify(jobManagementService).deleteJob(OWNER, jobId);
    }
}
