package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.ApiResponse;
import com.example.jobscheduler.dto.CalendarResponse;
import com.example.jobscheduler.service.calendar.CalendarService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/calendar")
@Tag(name = "Calendar", description = "Projected job occurrences")
public class CalendarController {

    private final CalendarService calendarService;

    @GetMapping("/jobs")
    @Operation(summary = "Project jobs onto a month", description = "Upcoming fire times of the caller's enabled jobs")
    public ResponseEntity<ApiResponse<CalendarResponse>> getJobEvents(
            @RequestHeader(JobController.OWNER_HEADER) String ownerEmail,
            @Parameter(description = "Month as YYYY-MM, defaults to the current month") @RequestParam(required = false) String month) {
        return ResponseEntity.ok(ApiResponse.success(calendarService.getMonth(ownerEmail, month)));
    }
}
