package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One projected job occurrence as shown on the calendar
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEvent {

    public static final String SOURCE_JOB = "job";
    public static final String STATUS_SCHEDULED = "scheduled";

    /**
     * "job:{jobId}:{startsAt}"
     */
    private String id;
    private String title;
    private Instant startsAt;
    private String source;
    private String status;
    private boolean editable;
    private Map<String, Object> metadata;
}
