package com.example.jobscheduler.service.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input of one engine invocation
 */
@Value
@Builder
public class EngineRequest {
    String prompt;
    String ownerEmail;
    String systemInstruction;
    List<AgentTool> tools;
    int maxSteps;
}
