package com.example.jobscheduler.service.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Output of one engine invocation: final text plus the trace of internal steps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineResult {

    private String text;

    @Builder.Default
    private List<Step> steps = new ArrayList<>();

    /**
     * Names of the tools called across all steps, de-duplicated in first-use order
     */
    public List<String> toolsUsed() {
        var names = new LinkedHashSet<String>();
        if (steps != null) {
            steps.stream()
                    .filter(Objects::nonNull)
                    .flatMap(step -> step.getToolCalls() != null ? step.getToolCalls().stream() : Stream.empty())
                    .map(ToolCall::getToolName)
                    .filter(Objects::nonNull)
                    .forEach(names::add);
        }
        return List.copyOf(names);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Step {
        @Builder.Default
        private List<ToolCall> toolCalls = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolCall {
        private String toolName;
    }
}
