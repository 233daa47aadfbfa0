package com.example.jobscheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a new job.
 * <p>
 * Either {@code schedule} (a preset name) or {@code cronExpression} must be given.
 * Presence of the required fields is checked by the service so the error lists them all;
 * lengths are bounded here by the column sizes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    @Size(max = 200, message = "Name must not exceed 200 characters")
    private String name;

    private String prompt;

    /**
     * Preset name or alias, e.g. "daily" or "weekly_friday"
     */
    private String schedule;

    /**
     * Time of day "HH:mm", defaults to 09:00
     */
    private String time;

    @JsonProperty("webhook_url")
    @Size(max = 2048, message = "Webhook URL must not exceed 2048 characters")
    private String webhookUrl;

    /**
     * Raw five-field expression, used instead of a preset
     */
    @JsonProperty("cron_expression")
    @Size(max = 100, message = "Cron expression must not exceed 100 characters")
    private String cronExpression;
}
