package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarResponse {

    /**
     * Month key "YYYY-MM" actually used
     */
    private String month;
    private List<CalendarEvent> events;
}
