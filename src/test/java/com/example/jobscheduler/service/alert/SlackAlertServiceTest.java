package com.example.jobscheduler.service.alert;

import com.example.jobscheduler.config.SlackProperties;
import com.example.jobscheduler.domain.entity.JobRun;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.enums.RunStatus;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackAlertService Tests")
class SlackAlertServiceTest {

    private static final String WEBHOOK = "https://hooks.slack.test/services/T000/B000/XXX";

    @Mock
    private Slack slack;

    @Captor
    private ArgumentCaptor<Payload> payloadCaptor;

    private SlackProperties properties;
    private ScheduledJob job;
    private JobRun run;

    @BeforeEach
    void setUp() {
        properties = new SlackProperties();
        properties.setWebhookUrl(WEBHOOK);

        job = ScheduledJob.builder()
                .id(UUID.randomUUID())
                .ownerEmail("owner@example.com")
                .name("Monday digest")
                .build();
        run = JobRun.builder()
                .id(UUID.randomUUID())
                .jobId(job.getId())
                .startedAt(Instant.parse("2025-03-03T12:01:00Z"))
                .status(RunStatus.FAILED)
                .error("engine down")
                .build();
    }

    @Test
    @DisplayName("Should post a failure alert with the job and error")
    void shouldSendRunFailureAlert() throws IOException {
        when(slack.send(eq(WEBHOOK), any(Payload.class))).thenReturn(WebhookResponse.builder().code(200).build());

        new SlackAlertService(properties, slack).sendRunFailureAlert(job, run);

        verify(slack).send(eq(WEBHOOK), payloadCaptor.capture());
        var attachment = payloadCaptor.getValue().getAttachments().get(0);
        assertThat(attachment.getTitle()).isEqualTo("Job: Monday digest");
        assertThat(attachment.getFields()).anyMatch(field -> field.getValue().contains("engine down"));
    }

    @Test
    @DisplayName("Should stay silent when no webhook is configured")
    void shouldSkipWhenUnconfigured() {
        properties.setWebhookUrl("");

        new SlackAlertService(properties, slack).sendRunFailureAlert(job, run);
        new SlackAlertService(properties, slack).sendErrorAlert("title", "message", null);

        verifyNoInteractions(slack);
    }

    @Test
    @DisplayName("Should swallow transport errors")
    void shouldSwallowErrors() throws IOException {
        when(slack.send(anyString(), any(Payload.class))).thenThrow(new IOException("unreachable"));

        assertThatCode(() -> new SlackAlertService(properties, slack).sendErrorAlert("title", "message", "details"))
                .doesNotThrowAnyException();
    }
}
