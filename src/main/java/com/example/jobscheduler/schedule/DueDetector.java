package com.example.jobscheduler.schedule;

import com.example.jobscheduler.exception.InvalidCronExpressionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Decides whether a schedule has a fire time that has not been handled yet.
 * <p>
 * A job is due when the most recent fire time at or before {@code now} is strictly
 * after its last run. A job that never ran is always due. This is a pure predicate:
 * it never touches the job's last-run marker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DueDetector {

    private final CronEvaluator cronEvaluator;

    /**
     * @param expression five-field cron expression
     * @param lastRunAt  start of the latest attempt, or null if the job never ran
     * @param now        sweep instant
     * @return true if an unhandled fire time exists; false for malformed expressions
     */
    public boolean isDue(String expression, Instant lastRunAt, Instant now) {
        try {
            var previous = cronEvaluator.parse(expression, now).previousFireBefore();
            if (previous.isEmpty()) {
                log.debug("Expression '{}' has no fire time before {}", expression, now);
                return false;
            }

            if (lastRunAt == null) {
                return true;
            }

            return previous.get().isAfter(lastRunAt);
        } catch (InvalidCronExpressionException e) {
            log.warn("Skipping schedule with malformed expression: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Could not evaluate expression '{}': {}", expression, e.getMessage());
            return false;
        }
    }
}
