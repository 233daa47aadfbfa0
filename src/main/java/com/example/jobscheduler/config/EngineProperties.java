package com.example.jobscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Task execution engine configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler.engine")
public class EngineProperties {

    @NotBlank
    private String baseUrl;

    private int timeoutSeconds = 240;

    /**
     * Ceiling on engine-internal steps for one invocation
     */
    @Min(1)
    private int maxSteps = 10;

    /**
     * System instruction sent with every scheduled prompt
     */
    @NotBlank
    private String systemInstruction = "You are a growth assistant running a scheduled task. "
            + "Use the available tools when they help and answer with a concise report.";

    /**
     * Tool names offered to the engine, scoped to the job owner at invocation time
     */
    private List<String> tools = new ArrayList<>();
}
