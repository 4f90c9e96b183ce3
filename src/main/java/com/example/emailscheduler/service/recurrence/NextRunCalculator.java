package com.example.emailscheduler.service.recurrence;

import com.example.emailscheduler.domain.model.ScheduleDefinition;
import com.example.emailscheduler.exception.RecurrenceParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the next due instant of a schedule.
 * <p>
 * Every method takes the reference time as an argument and has no side
 * effects beyond logging, so results depend only on the inputs:
 * <ul>
 *   <li>DATE_RANGE is due immediately</li>
 *   <li>RECURRING is due at the first cron occurrence strictly after now</li>
 *   <li>SPECIFIC_DATES is due at the earliest configured date strictly after now</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NextRunCalculator {

    private final RecurrenceStrategy recurrenceStrategy;

    /**
     * @return the next due instant, or empty when the schedule has nothing left to run
     *         or its recurrence cannot be evaluated
     */
    public Optional<Instant> calculateNextExecution(ScheduleDefinition definition, Instant now) {
        if (definition.getType() == null) {
            return Optional.empty();
        }

        return switch (definition.getType()) {
            case DATE_RANGE -> Optional.of(now);
            case RECURRING -> nextRecurrence(definition, now);
            case SPECIFIC_DATES -> nextSpecificDate(definition.getSpecificDates(), now);
        };
    }

    /**
     * Next {@code count} occurrences of a recurrence strictly after {@code from}.
     *
     * @throws RecurrenceParseException if the expression or timezone is invalid
     */
    public List<Instant> upcomingOccurrences(String expression, String timezone, Instant from, int count) {
        var zone = resolveZone(timezone);
        var occurrences = new ArrayList<Instant>(count);
        var cursor = from;
        while (occurrences.size() < count) {
            var next = recurrenceStrategy.nextOccurrence(expression, zone, cursor);
            if (next.isEmpty()) {
                break;
            }
            occurrences.add(next.get());
            cursor = next.get();
        }
        return occurrences;
    }

    /**
     * Smallest gap between the next few occurrences, used to flag recurrences
     * that fire more often than the poller can pick them up.
     *
     * @throws RecurrenceParseException if the expression or timezone is invalid
     */
    public Optional<Duration> shortestInterval(String expression, String timezone, Instant from) {
        var occurrences = upcomingOccurrences(expression, timezone, from, 5);
        Duration shortest = null;
        for (int i = 1; i < occurrences.size(); i++) {
            var gap = Duration.between(occurrences.get(i - 1), occurrences.get(i));
            if (shortest == null || gap.compareTo(shortest) < 0) {
                shortest = gap;
            }
        }
        return Optional.ofNullable(shortest);
    }

    /**
     * Resolve a schedule timezone; missing values mean UTC.
     *
     * @throws RecurrenceParseException if the zone id is unknown
     */
    public ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new RecurrenceParseException(timezone, "unknown timezone");
        }
    }

    private Optional<Instant> nextRecurrence(ScheduleDefinition definition, Instant now) {
        try {
            var zone = resolveZone(definition.getTimezone());
            return recurrenceStrategy.nextOccurrence(definition.getCronExpression(), zone, now);
        } catch (RecurrenceParseException e) {
            log.warn("Cannot compute next run for recurrence '{}' ({}): {}",
                    definition.getCronExpression(), definition.getTimezone(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Instant> nextSpecificDate(List<Instant> dates, Instant now) {
        if (dates == null) {
            return Optional.empty();
        }
        return dates.stream()
                .filter(Objects::nonNull)
                .filter(date -> date.isAfter(now))
                .min(Instant::compareTo);
    }
}
