package com.example.jobscheduler.service.calendar;

import com.example.jobscheduler.domain.repository.ScheduledJobRepository;
import com.example.jobscheduler.dto.CalendarEvent;
import com.example.jobscheduler.dto.CalendarResponse;
import com.example.jobscheduler.schedule.OccurrenceProjector;
import com.example.jobscheduler.schedule.ProjectedOccurrence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Projects an owner's jobs onto a calendar month.
 * Nothing is executed or persisted; events are recomputed on every request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarService {

    private static final Pattern MONTH_KEY = Pattern.compile("^(\\d{4})-(\\d{2})$");

    private final ScheduledJobRepository jobRepository;
    private final OccurrenceProjector occurrenceProjector;
    private final Clock clock;

    /**
     * Resolve a "YYYY-MM" key to its UTC month range.
     * A missing or malformed key, or a month outside 1-12, falls back to the current month.
     */
    public MonthRange parseMonthKey(String monthKey) {
        var current = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        var matcher = monthKey == null ? null : MONTH_KEY.matcher(monthKey.trim());

        var year = current.getYear();
        var month = current.getMonthValue();
        if (matcher != null && matcher.matches()) {
            year = Integer.parseInt(matcher.group(1));
            var requested = Integer.parseInt(matcher.group(2));
            if (requested >= 1 && requested <= 12) {
                month = requested;
            }
        }

        var yearMonth = YearMonth.of(year, month);
        return new MonthRange(
                yearMonth.toString(),
                startOf(yearMonth.atDay(1)),
                startOf(yearMonth.plusMonths(1).atDay(1)));
    }

    /**
     * Calendar events for every job of the owner within the range, sorted by start
     */
    @Transactional(readOnly = true)
    public List<CalendarEvent> buildJobEventsForRange(String ownerEmail, MonthRange range) {
        return jobRepository.findByOwnerEmailOrderByCreatedAtDesc(ownerEmail).stream()
                .flatMap(job -> occurrenceProjector.project(job, range.getStart(), range.getEnd()).stream())
                .map(this::toEvent)
                .sorted(Comparator.comparing(CalendarEvent::getStartsAt))
                .toList();
    }

    public CalendarResponse getMonth(String ownerEmail, String monthKey) {
        var range = parseMonthKey(monthKey);
        var events = buildJobEventsForRange(ownerEmail, range);

        log.debug("Projected {} job events for {} in {}", events.size(), ownerEmail, range.getMonthKey());

        return CalendarResponse.builder()
                .month(range.getMonthKey())
                .events(events)
                .build();
    }

    private CalendarEvent toEvent(ProjectedOccurrence occurrence) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("jobId", occurrence.getJobId());
        metadata.put("cron", occurrence.getCronExpression());
        metadata.put("webhookUrl", occurrence.getWebhookUrl());

        return CalendarEvent.builder()
                .id("job:" + occurrence.getJobId() + ":" + occurrence.getFiresAt())
                .title(occurrence.getJobName())
                .startsAt(occurrence.getFiresAt())
                .source(CalendarEvent.SOURCE_JOB)
                .status(CalendarEvent.STATUS_SCHEDULED)
                .editable(false)
                .metadata(metadata)
                .build();
    }

    private static Instant startOf(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
