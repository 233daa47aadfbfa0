package com.example.jobscheduler.schedule;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the fire times of a job inside {@code [start, end)} without executing anything.
 * <p>
 * Bounded by a fixed number of iterations per call. A malformed expression yields an
 * empty list so that one broken job cannot blank out a whole calendar. Stateless and
 * safe for concurrent use.
 */
@Slf4j
@Component
public class OccurrenceProjector {

    private static final Duration ANCHOR_OFFSET = Duration.ofMinutes(1);

    private final CronEvaluator cronEvaluator;
    private final int maxOccurrences;

    @Autowired
    public OccurrenceProjector(CronEvaluator cronEvaluator, JobSchedulerProperties properties) {
        this(cronEvaluator, properties.getMaxOccurrences());
    }

    public OccurrenceProjector(CronEvaluator cronEvaluator, int maxOccurrences) {
        this.cronEvaluator = cronEvaluator;
        this.maxOccurrences = maxOccurrences;
    }

    /**
     * Project a job's occurrences in a half-open range.
     *
     * @param job   the job; disabled jobs project nothing
     * @param start inclusive range start
     * @param end   exclusive range end
     * @return fire times in ascending order, at most the configured cap
     */
    public List<ProjectedOccurrence> project(ScheduledJob job, Instant start, Instant end) {
        if (!job.isEnabled() || !end.isAfter(start)) {
            return List.of();
        }

        try {
            var iterator = cronEvaluator.parse(job.getCronExpression(), start.minus(ANCHOR_OFFSET));
            var occurrences = new ArrayList<ProjectedOccurrence>();

            for (var i = 0; i < maxOccurrences; i++) {
                var next = iterator.nextFireAfter();
                if (next.isEmpty()) {
                    break;
                }

                var firesAt = next.get();
                if (!firesAt.isBefore(end)) {
                    break;
                }
                if (firesAt.isBefore(start)) {
                    continue;
                }

                occurrences.add(ProjectedOccurrence.builder()
                        .jobId(job.getId())
                        .jobName(job.getName())
                        .cronExpression(job.getCronExpression())
                        .webhookUrl(job.getWebhookUrl())
                        .firesAt(firesAt)
                        .build());
            }

            return occurrences;
        } catch (RuntimeException e) {
            log.warn("Cannot project occurrences for job {}: {}", job.getId(), e.getMessage());
            return List.of();
        }
    }
}
