package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Schedule presets offered by the job creation form
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresetResponse {

    private List<Preset> presets;
    private String defaultTime;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Preset {
        private String id;
        private String label;
    }
}
