package com.example.jobscheduler.schedule;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.exception.InvalidCronExpressionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates five-field UNIX cron expressions in one fixed zone.
 * <p>
 * Due-detection and occurrence projection both go through this class so that they
 * agree on fire times regardless of the caller's locale.
 */
@Slf4j
@Component
public class CronEvaluator {

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final int CACHE_SIZE = 256;

    private final ZoneId zone;
    private final Map<String, ExecutionTime> cache = Collections.synchronizedMap(new LruMap<>(CACHE_SIZE));

    @Autowired
    public CronEvaluator(JobSchedulerProperties properties) {
        this(properties.getZoneId());
    }

    public CronEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone);
        log.info("Cron expressions are evaluated in zone {}", zone);
    }

    /**
     * Build an iterator over the fire times of an expression.
     *
     * @param expression       five-field cron expression
     * @param referenceInstant starting position of the iterator
     * @throws InvalidCronExpressionException if the expression is malformed
     */
    public CronIterator parse(String expression, Instant referenceInstant) {
        Objects.requireNonNull(referenceInstant);
        return new CronIterator(executionTimeFor(expression), zone, referenceInstant);
    }

    /**
     * Check an expression without iterating it
     *
     * @throws InvalidCronExpressionException if the expression is malformed
     */
    public void validate(String expression) {
        executionTimeFor(expression);
    }

    public boolean isValid(String expression) {
        try {
            validate(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    public ZoneId getZone() {
        return zone;
    }

    private ExecutionTime executionTimeFor(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is blank");
        }
        var normalized = expression.trim();
        try {
            return cache.computeIfAbsent(normalized, expr -> ExecutionTime.forCron(PARSER.parse(expr).validate()));
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(normalized, e);
        }
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;

        LruMap(int max) {
            super(16, 0.75f, true);
            this.max = max;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return size() > max;
        }
    }
}
