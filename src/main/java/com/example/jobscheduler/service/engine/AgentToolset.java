package com.example.jobscheduler.service.engine;

import com.example.jobscheduler.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the tools offered to the engine for one job owner.
 */
@Component
@RequiredArgsConstructor
public class AgentToolset {

    private final EngineProperties engineProperties;

    public List<AgentTool> forOwner(String ownerEmail) {
        return engineProperties.getTools().stream()
                .map(name -> AgentTool.builder().name(name).ownerEmail(ownerEmail).build())
                .toList();
    }
}
