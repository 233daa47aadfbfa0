package com.example.jobscheduler.service.engine;

import lombok.Builder;
import lombok.Value;

/**
 * A tool the engine may call, bound to the user it acts for
 */
@Value
@Builder
public class AgentTool {
    String name;
    String ownerEmail;
}
