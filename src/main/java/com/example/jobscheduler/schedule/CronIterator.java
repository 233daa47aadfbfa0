package com.example.jobscheduler.schedule;

import com.cronutils.model.time.ExecutionTime;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Walks the fire times of one cron expression from a reference instant.
 * <p>
 * Each call moves the cursor to the returned fire time, so repeated calls to
 * {@link #nextFireAfter()} produce increasing instants and repeated calls to
 * {@link #previousFireBefore()} produce decreasing ones. An empty result means
 * the sequence is exhausted in that direction.
 * <p>
 * Not thread-safe; create one iterator per traversal.
 */
public final class CronIterator {

    private final ExecutionTime executionTime;
    private final ZoneId zone;
    private ZonedDateTime cursor;
    private boolean inclusive = true;

    CronIterator(ExecutionTime executionTime, ZoneId zone, Instant reference) {
        this.executionTime = executionTime;
        this.zone = zone;
        this.cursor = reference.atZone(zone);
    }

    /**
     * Latest fire time at or before the cursor. After the first call the
     * cursor itself is excluded, so the walk never returns the same instant twice.
     */
    public Optional<Instant> previousFireBefore() {
        Optional<ZonedDateTime> previous;
        if (inclusive) {
            var base = cursor.truncatedTo(ChronoUnit.MINUTES);
            previous = executionTime.isMatch(base) ? Optional.of(base) : executionTime.lastExecution(base);
        } else {
            previous = executionTime.lastExecution(cursor);
        }

        previous.ifPresent(this::moveTo);
        return previous.map(ZonedDateTime::toInstant);
    }

    /**
     * Earliest fire time strictly after the cursor.
     */
    public Optional<Instant> nextFireAfter() {
        var next = executionTime.nextExecution(cursor);
        next.ifPresent(this::moveTo);
        return next.map(ZonedDateTime::toInstant);
    }

    /**
     * Current position of the walk
     */
    public Instant cursor() {
        return cursor.toInstant();
    }

    public ZoneId zone() {
        return zone;
    }

    private void moveTo(ZonedDateTime fireTime) {
        this.cursor = fireTime;
        this.inclusive = false;
    }
}
