package com.example.jobscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of recurrence presets offered when creating a job.
 * Each preset is a cron shape parameterized only by time of day.
 */
@Getter
@RequiredArgsConstructor
public enum SchedulePreset {

    DAILY_9AM("daily_9am", "Daily"),
    WEEKLY_MONDAY("weekly_monday", "Every Monday"),
    WEEKLY_FRIDAY("weekly_friday", "Every Friday"),
    BIWEEKLY("biweekly", "Every two weeks"),
    MONTHLY_FIRST("monthly_first", "Monthly");

    @JsonValue
    private final String id;
    private final String label;
}
