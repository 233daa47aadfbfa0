package com.example.jobscheduler.service.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * JSON envelope posted to a job's webhook after a completed run
 */
@Value
@Builder
public class WebhookPayload {

    public static final String STATUS_COMPLETED = "completed";

    @JsonProperty("job_name")
    String jobName;

    @JsonProperty("prompt")
    String prompt;

    @JsonProperty("response")
    String response;

    /**
     * ISO-8601 instant of delivery
     */
    @JsonProperty("executed_at")
    String executedAt;

    @JsonProperty("tools_used")
    List<String> toolsUsed;

    @JsonProperty("status")
    @Builder.Default
    String status = STATUS_COMPLETED;
}
