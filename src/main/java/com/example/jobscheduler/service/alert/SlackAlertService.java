package com.example.jobscheduler.service.alert;

import com.example.jobscheduler.config.SlackProperties;
import com.example.jobscheduler.domain.entity.JobRun;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Service for alerting operators on Slack when scheduled jobs fail.
 * <p>
 * Alerts are informational only: they run asynchronously and never change
 * the outcome of a run or a sweep.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:agent-job-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert for a run whose engine invocation failed.
     */
    @Async
    public void sendRunFailureAlert(ScheduledJob job, JobRun run) {
        if (!isConfigured()) {
            log.debug("Slack alerting disabled. Run {} of job {} failed without alert.", run.getId(), job.getId());
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":rotating_light:")
                    .text(":rotating_light: *Scheduled Job Run Failed*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("danger")
                                    .title("Job: " + job.getName())
                                    .titleLink(buildJobLink(job.getId().toString()))
                                    .fields(Arrays.asList(
                                            Field.builder()
                                                    .title("Job ID")
                                                    .value(job.getId().toString())
                                                    .valueShortEnough(true)
                                                    .build(),
                                            Field.builder()
                                                    .title("Run ID")
                                                    .value(String.valueOf(run.getId()))
                                                    .valueShortEnough(true)
                                                    .build(),
                                            Field.builder()
                                                    .title("Owner")
                                                    .value(job.getOwnerEmail())
                                                    .valueShortEnough(true)
                                                    .build(),
                                            Field.builder()
                                                    .title("Error")
                                                    .value("```" + truncate(run.getError(), 400) + "```")
                                                    .valueShortEnough(false)
                                                    .build()
                                    ))
                                    .footer(applicationName + " | The job runs again at its next fire time")
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for failed run {} of job {}", run.getId(), job.getId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    /**
     * Send generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.debug("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":warning:")
                    .text(":warning: *" + title + "*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .text(message)
                                    .fields(details != null ? List.of(
                                            Field.builder()
                                                    .title("Details")
                                                    .value(truncate(details, 500))
                                                    .valueShortEnough(false)
                                                    .build()
                                    ) : List.of())
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack error alert: {}", e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    private String buildJobLink(String jobId) {
        return slackProperties.getDashboardBaseUrl() + "/jobs/" + jobId;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
