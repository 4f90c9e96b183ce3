package com.example.emailscheduler.service.validation;

import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.enums.ScheduleType;
import com.example.emailscheduler.domain.model.ScheduleDefinition;
import com.example.emailscheduler.domain.repository.ProcessingScheduleRepository;
import com.example.emailscheduler.dto.ScheduleConflict;
import com.example.emailscheduler.exception.RecurrenceParseException;
import com.example.emailscheduler.service.recurrence.NextRunCalculator;
import com.example.emailscheduler.service.recurrence.RecurrenceStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Detects timing collisions between a candidate schedule and the existing
 * schedules of the same owner and account.
 * <p>
 * Rules per type:
 * <ul>
 *   <li>RECURRING: an enabled schedule with the same expression and timezone</li>
 *   <li>SPECIFIC_DATES: an enabled schedule sharing any date, reported per date</li>
 *   <li>DATE_RANGE: any schedule with the identical from/to pair</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleConflictChecker {

    private static final int ALTERNATIVE_HOURS = 3;

    private final ProcessingScheduleRepository scheduleRepository;
    private final NextRunCalculator nextRunCalculator;
    private final RecurrenceStrategy recurrenceStrategy;

    @Transactional(readOnly = true)
    public List<ScheduleConflict> findConflicts(ScheduleDefinition definition, UUID excludeId, Instant now) {
        if (definition.getOwnerId() == null || definition.getAccountId() == null || definition.getType() == null) {
            return List.of();
        }

        var candidates = scheduleRepository
                .findByOwnerIdAndAccountIdAndType(definition.getOwnerId(), definition.getAccountId(), definition.getType())
                .stream()
                .filter(existing -> excludeId == null || !excludeId.equals(existing.getId()))
                .toList();

        if (candidates.isEmpty()) {
            return List.of();
        }

        return switch (definition.getType()) {
            case RECURRING -> recurringConflicts(definition, candidates, now);
            case SPECIFIC_DATES -> specificDateConflicts(definition, candidates);
            case DATE_RANGE -> dateRangeConflicts(definition, candidates);
        };
    }

    /**
     * Alternatives to a colliding instant: one, two and three hours later, and
     * the same wall-clock time on the next day.
     */
    public List<Instant> suggestAlternatives(Instant conflictTime, ZoneId zone) {
        var alternatives = new ArrayList<Instant>(ALTERNATIVE_HOURS + 1);
        for (int hours = 1; hours <= ALTERNATIVE_HOURS; hours++) {
            alternatives.add(conflictTime.plusSeconds(hours * 3600L));
        }
        alternatives.add(conflictTime.atZone(zone).plusDays(1).toInstant());
        return alternatives;
    }

    private List<ScheduleConflict> recurringConflicts(ScheduleDefinition definition, List<ProcessingSchedule> candidates, Instant now) {
        if (definition.getCronExpression() == null) {
            return List.of();
        }
        var expression = normalizeExpression(definition.getCronExpression());
        var timezone = normalizeTimezone(definition.getTimezone());

        var matching = candidates.stream()
                .filter(ProcessingSchedule::isEnabled)
                .filter(existing -> expression.equals(normalizeExpression(existing.getCronExpression())))
                .filter(existing -> timezone.equals(normalizeTimezone(existing.getTimezone())))
                .toList();

        if (matching.isEmpty()) {
            return List.of();
        }

        Instant conflictTime = null;
        List<Instant> alternatives = List.of();
        try {
            var zone = nextRunCalculator.resolveZone(timezone);
            conflictTime = recurrenceStrategy.nextOccurrence(expression, zone, now).orElse(null);
            if (conflictTime != null) {
                alternatives = suggestAlternatives(conflictTime, zone);
            }
        } catch (RecurrenceParseException e) {
            log.debug("Conflict on unparsable recurrence '{}': {}", expression, e.getMessage());
        }

        return List.of(ScheduleConflict.builder()
                .conflictTime(conflictTime)
                .reason(String.format("A recurring schedule with expression '%s' in %s already exists for this account",
                        expression, timezone))
                .conflictingScheduleIds(matching.stream().map(ProcessingSchedule::getId).toList())
                .conflictingScheduleNames(matching.stream().map(ProcessingSchedule::getName).toList())
                .suggestedAlternatives(alternatives)
                .build());
    }

    private List<ScheduleConflict> specificDateConflicts(ScheduleDefinition definition, List<ProcessingSchedule> candidates) {
        var enabled = candidates.stream().filter(ProcessingSchedule::isEnabled).toList();
        var zone = zoneOrUtc(definition.getTimezone());
        var conflicts = new ArrayList<ScheduleConflict>();

        for (var date : new LinkedHashSet<>(definition.getSpecificDates())) {
            if (date == null) {
                continue;
            }
            var matching = enabled.stream()
                    .filter(existing -> existing.getSpecificDates() != null && existing.getSpecificDates().contains(date))
                    .toList();
            if (matching.isEmpty()) {
                continue;
            }
            conflicts.add(ScheduleConflict.builder()
                    .conflictTime(date)
                    .reason("Another schedule for this account already runs at " + date)
                    .conflictingScheduleIds(matching.stream().map(ProcessingSchedule::getId).toList())
                    .conflictingScheduleNames(matching.stream().map(ProcessingSchedule::getName).toList())
                    .suggestedAlternatives(suggestAlternatives(date, zone))
                    .build());
        }
        return conflicts;
    }

    private List<ScheduleConflict> dateRangeConflicts(ScheduleDefinition definition, List<ProcessingSchedule> candidates) {
        if (definition.getDateRangeFrom() == null || definition.getDateRangeTo() == null) {
            return List.of();
        }
        var matching = candidates.stream()
                .filter(existing -> Objects.equals(existing.getDateRangeFrom(), definition.getDateRangeFrom()))
                .filter(existing -> Objects.equals(existing.getDateRangeTo(), definition.getDateRangeTo()))
                .toList();

        if (matching.isEmpty()) {
            return List.of();
        }
        return List.of(ScheduleConflict.builder()
                .reason("A date range schedule with the same dates already exists for this account")
                .conflictingScheduleIds(matching.stream().map(ProcessingSchedule::getId).toList())
                .conflictingScheduleNames(matching.stream().map(ProcessingSchedule::getName).toList())
                .suggestedAlternatives(List.of())
                .build());
    }

    private ZoneId zoneOrUtc(String timezone) {
        try {
            return nextRunCalculator.resolveZone(timezone);
        } catch (RecurrenceParseException e) {
            return ZoneId.of("UTC");
        }
    }

    private static String normalizeExpression(String expression) {
        return expression == null ? "" : expression.trim().replaceAll("\\s+", " ");
    }

    private static String normalizeTimezone(String timezone) {
        return timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
    }
}
