package com.example.emailscheduler.service.recurrence;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.example.emailscheduler.exception.RecurrenceParseException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Five-field Unix cron expressions (minute hour day-of-month month day-of-week).
 */
@Component
public class CronRecurrenceStrategy implements RecurrenceStrategy {

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    static final int MAX_CACHED_EXPRESSIONS = 1024;

    // Least recently used expressions are dropped once the cap is reached
    private final Map<String, ExecutionTime> cache = Collections.synchronizedMap(
            new LinkedHashMap<>(64, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, ExecutionTime> eldest) {
                    return size() > MAX_CACHED_EXPRESSIONS;
                }
            });

    @Override
    public Optional<Instant> nextOccurrence(String expression, ZoneId zone, Instant after) {
        var executionTime = executionTime(expression);
        var cursor = after.atZone(zone);

        // nextExecution may return the reference time itself when it matches exactly
        var next = executionTime.nextExecution(cursor);
        while (next.isPresent() && !next.get().toInstant().isAfter(after)) {
            next = executionTime.nextExecution(next.get().plusSeconds(1));
        }
        return next.map(ZonedDateTime::toInstant);
    }

    @Override
    public void validate(String expression) {
        executionTime(expression);
    }

    private ExecutionTime executionTime(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new RecurrenceParseException(String.valueOf(expression), "expression is empty");
        }
        var normalized = expression.trim().replaceAll("\\s+", " ");
        var cached = cache.get(normalized);
        if (cached != null) {
            return cached;
        }
        try {
            var parsed = ExecutionTime.forCron(parser.parse(normalized));
            cache.put(normalized, parsed);
            return parsed;
        } catch (IllegalArgumentException e) {
            throw new RecurrenceParseException(expression, e);
        }
    }

    int cacheSize() {
        return cache.size();
    }
}
