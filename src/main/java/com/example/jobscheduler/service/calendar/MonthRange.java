package com.example.jobscheduler.service.calendar;

import lombok.Value;

import java.time.Instant;

/**
 * A calendar month in UTC, {@code [start, end)}
 */
@Value
public class MonthRange {

    /**
     * "YYYY-MM"
     */
    String monthKey;
    Instant start;
    Instant end;
}
