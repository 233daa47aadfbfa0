package com.example.jobscheduler.service;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.entity.JobRun;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.repository.JobRunRepository;
import com.example.jobscheduler.domain.repository.ScheduledJobRepository;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.JobRunResponse;
import com.example.jobscheduler.exception.InvalidCronExpressionException;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.mapper.JobMapper;
import com.example.jobscheduler.schedule.CronEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobManagementService Tests")
class JobManagementServiceTest {

    private static final String OWNER = "owner@example.com";

    @Mock
    private ScheduledJobRepository jobRepository;

    @Mock
    private JobRunRepository runRepository;

    @Mock
    private JobMapper jobMapper;

    @Captor
    private ArgumentCaptor<ScheduledJob> jobCaptor;

    @Captor
    private ArgumentCaptor<Pageable> pageableCaptor;

    private JobManagementService jobManagementService;

    @BeforeEach
    void setUp() {
        jobManagementService = new JobManagementService(jobRepository, runRepository,
                new CronEvaluator(ZoneOffset.UTC), jobMapper, new JobSchedulerProperties());
    }

    private static CreateJobRequest.CreateJobRequestBuilder validRequest() {
        return CreateJobRequest.builder()
                .name("Monday digest")
                .prompt("Summarize last week")
                .schedule("weekly")
                .webhookUrl("https://hooks.example.com/digest");
    }

    @Nested
    @DisplayName("createJob Tests")
    class CreateJobTests {

        @BeforeEach
        void stubSave() {
            lenient().when(jobRepository.save(any(ScheduledJob.class))).thenAnswer(inv -> {
                ScheduledJob job = inv.getArgument(0);
                job.setId(UUID.randomUUID());
                return job;
            });
            lenient().when(jobMapper.toResponse(any(ScheduledJob.class))).thenReturn(new JobResponse());
        }

        @Test
        @DisplayName("Should build the expression from the preset at the default time")
        void shouldCreateFromPreset() {
            jobManagementService.createJob(OWNER, validRequest().build());

            verify(jobRepository).save(jobCaptor.capture());
            var saved = jobCaptor.getValue();
            assertThat(saved.getCronExpression()).isEqualTo("0 9 * * 1");
            assertThat(saved.getOwnerEmail()).isEqualTo(OWNER);
            assertThat(saved.isEnabled()).isTrue();
            assertThat(saved.getLastRunAt()).isNull();
        }

        @Test
        @DisplayName("Should honor a custom time")
        void shouldUseCustomTime() {
            jobManagementService.createJob(OWNER, validRequest().schedule("weekly_friday").time("17:30").build());

            verify(jobRepository).save(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getCronExpression()).isEqualTo("30 17 * * 5");
        }

        @Test
        @DisplayName("Should default a blank time to 09:00")
        void shouldDefaultBlankTime() {
            jobManagementService.createJob(OWNER, validRequest().schedule("daily").time("  ").build());

            verify(jobRepository).save(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getCronExpression()).isEqualTo("0 9 * * *");
        }

        @Test
        @DisplayName("Should accept a raw cron expression instead of a preset")
        void shouldAcceptRawExpression() {
            jobManagementService.createJob(OWNER, validRequest().schedule(null).cronExpression(" */30 * * * * ").build());

            verify(jobRepository).save(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getCronExpression()).isEqualTo("*/30 * * * *");
        }

        @Test
        @DisplayName("Should reject missing fields")
        void shouldRejectMissingFields() {
            assertThatThrownBy(() -> jobManagementService.createJob(OWNER, validRequest().webhookUrl(null).build()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Missing required fields: name, prompt, schedule, webhook_url");
            assertThatThrownBy(() -> jobManagementService.createJob(OWNER, validRequest().schedule(null).build()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Missing required fields: name, prompt, schedule, webhook_url");
            verify(jobRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject an unknown preset listing the valid ones")
        void shouldRejectUnknownPreset() {
            assertThatThrownBy(() -> jobManagementService.createJob(OWNER, validRequest().schedule("hourly").build()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid schedule preset. Valid: daily_9am, weekly_monday, weekly_friday, biweekly, monthly_first");
        }

        @Test
        @DisplayName("Should reject an invalid time")
        void shouldRejectInvalidTime() {
            assertThatThrownBy(() -> jobManagementService.createJob(OWNER, validRequest().time("25:00").build()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid time. Use HH:mm (24-hour format).");
        }

        @Test
        @DisplayName("Should reject a malformed raw expression")
        void shouldRejectMalformedExpression() {
            assertThatThrownBy(() -> jobManagementService.createJob(OWNER, validRequest().cronExpression("61 * * * *").build()))
                    .isInstanceOf(InvalidCronExpressionException.class);
            verify(jobRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Retrieval Tests")
    class RetrievalTests {

        @Test
        @DisplayName("Should return a job with its ten latest runs")
        void shouldReturnDetail() {
            var jobId = UUID.randomUUID();
            var job = ScheduledJob.builder().id(jobId).ownerEmail(OWNER).name("digest").build();
            var run = JobRun.builder().id(UUID.randomUUID()).jobId(jobId).status(RunStatus.COMPLETED)
                    .startedAt(Instant.parse("2025-03-03T12:01:00Z")).build();
            when(jobRepository.findByIdAndOwnerEmail(jobId, OWNER)).thenReturn(Optional.of(job));
            when(runRepository.findByJobIdOrderByStartedAtDesc(eq(jobId), pageableCaptor.capture())).thenReturn(List.of(run));
            when(jobMapper.toResponse(job)).thenReturn(JobResponse.builder().id(jobId).build());
            when(jobMapper.toRunResponses(List.of(run))).thenReturn(List.of(JobRunResponse.builder().id(run.getId()).build()));

            var detail = jobManagementService.getJob(OWNER, jobId);

            assertThat(detail.getJob().getId()).isEqualTo(jobId);
            assertThat(detail.getRuns()).hasSize(1);
            assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(10);
        }

        @Test
        @DisplayName("Should treat another owner's job as missing")
        void shouldHideOtherOwnersJob() {
            var jobId = UUID.randomUUID();
            when(jobRepository.findByIdAndOwnerEmail(jobId, "intruder@example.com")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> jobManagementService.getJob("intruder@example.com", jobId))
                    .isInstanceOf(JobNotFoundException.class);
            verifyNoInteractions(runRepository);
        }

        @Test
        @DisplayName("Should clamp the run history limit")
        void shouldClampRunLimit() {
            var jobId = UUID.randomUUID();
            when(jobRepository.findByIdAndOwnerEmail(jobId, OWNER))
                    .thenReturn(Optional.of(ScheduledJob.builder().id(jobId).ownerEmail(OWNER).build()));
            when(runRepository.findByJobIdOrderByStartedAtDesc(eq(jobId), pageableCaptor.capture())).thenReturn(List.of());

            jobManagementService.getRuns(OWNER, jobId, 5000);

            assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(100);
        }

        @Test
        @DisplayName("Should list every preset with the default time")
        void shouldListPresets() {
            var presets = jobManagementService.getPresets();

            assertThat(presets.getDefaultTime()).isEqualTo("09:00");
            assertThat(presets.getPresets()).hasSize(5);
            assertThat(presets.getPresets().get(0).getId()).isEqualTo("daily_9am");
        }
    }

    @Nested
    @DisplayName("Status Management Tests")
    class StatusTests {

        @Test
        @DisplayName("Should toggle a job owned by the caller")
        void shouldToggle() {
            var jobId = UUID.randomUUID();
            var job = ScheduledJob.builder().id(jobId).ownerEmail(OWNER).enabled(false).build();
            when(jobRepository.updateEnabled(jobId, OWNER, false)).thenReturn(1);
            when(jobRepository.findByIdAndOwnerEmail(jobId, OWNER)).thenReturn(Optional.of(job));
            when(jobMapper.toResponse(job)).thenReturn(JobResponse.builder().id(jobId).enabled(false).build());

            var response = jobManagementService.toggleJob(OWNER, jobId, false);

            assertThat(response.isEnabled()).isFalse();
        }

        @Test
        @DisplayName("Should fail to toggle a job that is not the caller's")
        void shouldFailToggleForOtherOwner() {
            var jobId = UUID.randomUUID();
            when(jobRepository.updateEnabled(jobId, OWNER, true)).thenReturn(0);

            assertThatThrownBy(() -> jobManagementService.toggleJob(OWNER, jobId, true))
                    .isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("Should delete scoped to the owner")
        void shouldDelete() {
            var jobId = UUID.randomUUID();
            when(jobRepository.deleteByIdAndOwner(jobId, OWNER)).thenReturn(1);

            jobManagementService.deleteJob(OWNER, jobId);

            verify(jobRepository).deleteByIdAndOwner(jobId, OWNER);
        }
    }
}
