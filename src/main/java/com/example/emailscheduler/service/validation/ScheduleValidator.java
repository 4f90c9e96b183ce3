package com.example.emailscheduler.service.validation;

import com.example.emailscheduler.config.EmailSchedulerProperties;
import com.example.emailscheduler.domain.enums.Priority;
import com.example.emailscheduler.domain.model.ScheduleDefinition;
import com.example.emailscheduler.dto.ValidationResult;
import com.example.emailscheduler.exception.RecurrenceParseException;
import com.example.emailscheduler.service.recurrence.NextRunCalculator;
import com.example.emailscheduler.service.recurrence.RecurrenceStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Validates a schedule configuration before it is persisted.
 * <p>
 * Never throws for configuration problems; every issue is collected into the
 * returned {@link ValidationResult}. Conflicts are only looked up once the
 * configuration itself is well formed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleValidator {

    private final RecurrenceStrategy recurrenceStrategy;
    private final NextRunCalculator nextRunCalculator;
    private final ScheduleConflictChecker conflictChecker;
    private final EmailSchedulerProperties properties;

    public ValidationResult validate(ScheduleDefinition definition, UUID excludeId) {
        return validate(definition, excludeId, Instant.now());
    }

    public ValidationResult validate(ScheduleDefinition definition, UUID excludeId, Instant now) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        if (definition.getType() == null) {
            errors.add("Schedule type is required.");
        } else {
            switch (definition.getType()) {
                case RECURRING -> validateRecurring(definition, now, errors, warnings);
                case SPECIFIC_DATES -> validateSpecificDates(definition, now, errors, warnings);
                case DATE_RANGE -> validateDateRange(definition, now, errors, warnings);
            }
        }

        validateBatchSize(definition.getBatchSize(), errors, warnings);
        validatePriorities("category", definition.getCategoryPriorities(), errors);
        validatePriorities("sender", definition.getSenderPriorities(), errors);

        var result = ValidationResult.builder()
                .errors(errors)
                .warnings(warnings)
                .build();

        if (errors.isEmpty()) {
            var conflicts = conflictChecker.findConflicts(definition, excludeId, now);
            result.setConflicts(new ArrayList<>(conflicts));
            conflicts.forEach(conflict -> errors.add(conflict.getReason()));
        }

        result.setValid(errors.isEmpty());
        if (!result.isValid()) {
            log.debug("Schedule configuration rejected: {}", errors);
        }
        return result;
    }

    private void validateRecurring(ScheduleDefinition definition, Instant now, List<String> errors, List<String> warnings) {
        var expression = definition.getCronExpression();
        if (expression == null || expression.isBlank()) {
            errors.add("Cron expression is required for recurring schedules.");
            return;
        }

        var parseable = true;
        try {
            recurrenceStrategy.validate(expression);
        } catch (RecurrenceParseException e) {
            errors.add("Invalid cron expression: " + rootMessage(e) + ". Please check the format.");
            parseable = false;
        }

        try {
            nextRunCalculator.resolveZone(definition.getTimezone());
        } catch (RecurrenceParseException e) {
            errors.add("Unknown timezone: " + definition.getTimezone() + ".");
            parseable = false;
        }

        if (!parseable) {
            return;
        }

        var pollInterval = Duration.ofMillis(properties.getPollIntervalMs());
        nextRunCalculator.shortestInterval(expression, definition.getTimezone(), now)
                .filter(interval -> interval.compareTo(pollInterval) < 0)
                .ifPresent(interval -> warnings.add(String.format(
                        "Cron expression fires every %ds but schedules are polled every %ds; some occurrences will be merged.",
                        interval.toSeconds(), pollInterval.toSeconds())));
    }

    private void validateSpecificDates(ScheduleDefinition definition, Instant now, List<String> errors, List<String> warnings) {
        var dates = definition.getSpecificDates().stream().filter(Objects::nonNull).toList();
        if (dates.isEmpty()) {
            errors.add("Specific dates are required for specific date schedules.");
            return;
        }

        var future = dates.stream().filter(date -> date.isAfter(now)).count();
        if (future == 0) {
            errors.add("No future specific dates found.");
        } else if (future < dates.size()) {
            warnings.add(String.format("%d specific date(s) are in the past and will be ignored.", dates.size() - future));
        }
    }

    private void validateDateRange(ScheduleDefinition definition, Instant now, List<String> errors, List<String> warnings) {
        var from = definition.getDateRangeFrom();
        var to = definition.getDateRangeTo();
        if (from == null || to == null) {
            errors.add("Date range is required for date range schedules.");
            return;
        }
        if (!from.isBefore(to)) {
            errors.add("Date range from must be before date range to.");
            return;
        }
        if (to.isAfter(now)) {
            warnings.add("Date range ends in the future; emails arriving after the run will not be processed.");
        }
    }

    private void validateBatchSize(Integer batchSize, List<String> errors, List<String> warnings) {
        if (batchSize == null) {
            return;
        }
        if (batchSize < 1) {
            errors.add("Batch size must be at least 1.");
        } else if (batchSize > properties.getMaxEmailsPerExecution()) {
            warnings.add(String.format("Batch size %d exceeds the %d emails fetched per execution.",
                    batchSize, properties.getMaxEmailsPerExecution()));
        }
    }

    private void validatePriorities(String kind, Map<String, String> priorities, List<String> errors) {
        if (priorities == null) {
            return;
        }
        priorities.forEach((key, value) -> {
            if (!Priority.isValid(value)) {
                errors.add(String.format("Invalid priority '%s' for %s '%s'. Allowed: %s.",
                        value, kind, key, Arrays.toString(Priority.values())));
            }
        });
    }

    private static String rootMessage(Exception e) {
        return e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
    }
}
