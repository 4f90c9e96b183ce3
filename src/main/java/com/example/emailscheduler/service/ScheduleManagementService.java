package com.example.emailscheduler.service;

import com.example.emailscheduler.config.EmailSchedulerProperties;
import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.entity.ScheduleExecution;
import com.example.emailscheduler.domain.enums.ExecutionStatus;
import com.example.emailscheduler.domain.enums.ScheduleType;
import com.example.emailscheduler.domain.model.ScheduleDefinition;
import com.example.emailscheduler.domain.repository.ProcessingScheduleRepository;
import com.example.emailscheduler.domain.repository.ScheduleExecutionRepository;
import com.example.emailscheduler.dto.BulkOperationResult;
import com.example.emailscheduler.dto.CalendarEntry;
import com.example.emailscheduler.dto.ConflictCheckRequest;
import com.example.emailscheduler.dto.ConflictCheckResponse;
import com.example.emailscheduler.dto.CreateScheduleRequest;
import com.example.emailscheduler.dto.ExecutionResponse;
import com.example.emailscheduler.dto.ExecutionStatusResponse;
import com.example.emailscheduler.dto.ScheduleAnalytics;
import com.example.emailscheduler.dto.ScheduleResponse;
import com.example.emailscheduler.dto.UpdateScheduleRequest;
import com.example.emailscheduler.dto.ValidationResult;
import com.example.emailscheduler.exception.RecurrenceParseException;
import com.example.emailscheduler.exception.ScheduleConflictException;
import com.example.emailscheduler.exception.ScheduleExecutionException;
import com.example.emailscheduler.exception.ScheduleNotFoundException;
import com.example.emailscheduler.exception.ScheduleValidationException;
import com.example.emailscheduler.mapper.ScheduleMapper;
import com.example.emailscheduler.service.executor.ExecutionTracker;
import com.example.emailscheduler.service.executor.ScheduleExecutionRunner;
import com.example.emailscheduler.service.recurrence.NextRunCalculator;
import com.example.emailscheduler.service.validation.ScheduleConflictChecker;
import com.example.emailscheduler.service.validation.ScheduleValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing schedule lifecycle operations.
 * <p>
 * Provides:
 * - Schedule creation and update behind validation and conflict detection
 * - Schedule querying, calendar and analytics
 * - Manual execution and execution status
 * - Bulk enable/disable
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleManagementService {

    static final String DEFAULT_SCHEDULE_NAME = "Initial";
    private static final int RECENT_EXECUTIONS = 10;
    private static final int ANALYTICS_RECENT_EXECUTIONS = 5;

    private final ProcessingScheduleRepository scheduleRepository;
    private final ScheduleExecutionRepository executionRepository;
    private final ScheduleValidator scheduleValidator;
    private final ScheduleConflictChecker conflictChecker;
    private final NextRunCalculator nextRunCalculator;
    private final ExecutionTracker executionTracker;
    private final ScheduleExecutionRunner executionRunner;
    private final ScheduleMapper scheduleMapper;
    private final EmailSchedulerProperties properties;

    // === Schedule Creation ===

    /**
     * Validate and persist a new schedule. Nothing is stored when validation fails.
     *
     * @throws ScheduleValidationException for an invalid configuration or a duplicate name
     * @throws ScheduleConflictException   when the timing collides with an existing schedule
     */
    @Transactional
    public ScheduleResponse createSchedule(CreateScheduleRequest request) {
        log.info("Creating {} schedule '{}' for owner {} account {}",
                request.getType(), request.getName(), request.getOwnerId(), request.getAccountId());

        if (scheduleRepository.existsByOwnerIdAndName(request.getOwnerId(), request.getName())) {
            throw new ScheduleValidationException("A schedule named '" + request.getName() + "' already exists");
        }

        var now = Instant.now();
        var definition = toDefinition(request);
        var validation = scheduleValidator.validate(definition, null, now);
        rejectIfInvalid(validation);

        var schedule = scheduleMapper.toEntity(request);
        schedule.setTimezone(definition.getTimezone());
        schedule.setBatchSize(definition.getBatchSize());
        schedule.setSpecificDates(new ArrayList<>(definition.getSpecificDates()));
        schedule.setCategoryPriorities(new HashMap<>(definition.getCategoryPriorities()));
        schedule.setSenderPriorities(new HashMap<>(definition.getSenderPriorities()));
        schedule.setCreatedAt(now);
        schedule.setNextExecutionAt(nextRunCalculator.calculateNextExecution(definition, now).orElse(null));

        schedule = scheduleRepository.save(schedule);
        log.info("Created schedule {} next due at {}", schedule.getId(), schedule.getNextExecutionAt());

        var response = scheduleMapper.toResponse(schedule);
        response.setWarnings(validation.getWarnings());
        return response;
    }

    /**
     * Create the disabled initial schedule of a newly connected account.
     * Returns the existing one when the account already has it.
     */
    @Transactional
    public ScheduleResponse createDefaultSchedule(String ownerId, String accountId) {
        var existing = scheduleRepository.findFirstByOwnerIdAndAccountIdAndDefaultScheduleTrue(ownerId, accountId);
        if (existing.isPresent()) {
            log.debug("Account {} already has default schedule {}", accountId, existing.get().getId());
            return scheduleMapper.toResponse(existing.get());
        }

        var now = Instant.now();
        var categoryPriorities = new LinkedHashMap<String, String>();
        categoryPriorities.put("APPOINTMENT", "HIGH");
        categoryPriorities.put("INVOICE", "HIGH");
        categoryPriorities.put("WORK", "MEDIUM");

        var schedule = ProcessingSchedule.builder()
                .ownerId(ownerId)
                .accountId(accountId)
                .name(DEFAULT_SCHEDULE_NAME + " - " + accountId)
                .description("Processes the last " + properties.getInitialLookbackDays() + " days of email")
                .type(ScheduleType.DATE_RANGE)
                .dateRangeFrom(now.minus(properties.getInitialLookbackDays(), ChronoUnit.DAYS))
                .dateRangeTo(now)
                .enabled(false)
                .defaultSchedule(true)
                .batchSize(properties.getDefaultBatchSize())
                .categoryPriorities(categoryPriorities)
                .nextExecutionAt(now)
                .createdAt(now)
                .build();

        schedule = scheduleRepository.save(schedule);
        log.info("Created default schedule {} for account {}", schedule.getId(), accountId);
        return scheduleMapper.toResponse(schedule);
    }

    // === Schedule Update / Delete ===

    /**
     * Apply the non-null fields of the request. Timing changes and re-enabling recompute the next due instant.
     */
    @Transactional
    public ScheduleResponse updateSchedule(UUID scheduleId, UpdateScheduleRequest request) {
        var schedule = findSchedule(scheduleId);

        if (request.getName() != null && !request.getName().equals(schedule.getName())
                && scheduleRepository.existsByOwnerIdAndNameAndIdNot(schedule.getOwnerId(), request.getName(), scheduleId)) {
            throw new ScheduleValidationException("A schedule named '" + request.getName() + "' already exists");
        }

        var reenabling = Boolean.TRUE.equals(request.getEnabled()) && !schedule.isEnabled();
        var recompute = request.changesTiming() || reenabling;
        var now = Instant.now();
        var definition = mergeDefinition(schedule.toDefinition(), request);

        List<String> warnings = List.of();
        if (recompute || request.getBatchSize() != null
                || request.getCategoryPriorities() != null || request.getSenderPriorities() != null) {
            var validation = scheduleValidator.validate(definition, scheduleId, now);
            rejectIfInvalid(validation);
            warnings = validation.getWarnings();
        }

        scheduleMapper.updateEntity(request, schedule);
        schedule.setTimezone(definition.getTimezone());
        if (request.getSpecificDates() != null) {
            schedule.getSpecificDates().clear();
            schedule.getSpecificDates().addAll(definition.getSpecificDates());
        }
        if (request.getCategoryPriorities() != null) {
            schedule.setCategoryPriorities(new HashMap<>(request.getCategoryPriorities()));
        }
        if (request.getSenderPriorities() != null) {
            schedule.setSenderPriorities(new HashMap<>(request.getSenderPriorities()));
        }
        if (recompute) {
            schedule.setNextExecutionAt(nextRunCalculator.calculateNextExecution(definition, now).orElse(null));
        }

        schedule = scheduleRepository.save(schedule);
        log.info("Updated schedule {} (next due at {})", scheduleId, schedule.getNextExecutionAt());

        var response = scheduleMapper.toResponse(schedule);
        response.setWarnings(warnings);
        return response;
    }

    @Transactional
    public void deleteSchedule(UUID scheduleId) {
        var schedule = findSchedule(scheduleId);
        var executions = executionRepository.deleteByScheduleId(scheduleId);
        scheduleRepository.delete(schedule);
        log.info("Deleted schedule {} and {} executions", scheduleId, executions);
    }

    // === Schedule Retrieval ===

    /**
     * Get schedule with its most recent executions
     */
    @Transactional(readOnly = true)
    public ScheduleResponse getSchedule(UUID scheduleId) {
        var response = scheduleMapper.toResponse(findSchedule(scheduleId));
        var executions = executionRepository.findByScheduleIdOrderByStartedAtDesc(scheduleId, PageRequest.of(0, RECENT_EXECUTIONS));
        response.setRecentExecutions(scheduleMapper.toExecutionResponses(executions));
        return response;
    }

    @Transactional(readOnly = true)
    public List<ScheduleResponse> getSchedulesByOwner(String ownerId) {
        return scheduleMapper.toResponseList(scheduleRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId));
    }

    @Transactional(readOnly = true)
    public List<ScheduleResponse> getSchedulesByAccount(String accountId) {
        return scheduleMapper.toResponseList(scheduleRepository.findByAccountIdOrderByCreatedAtDesc(accountId));
    }

    // === Execution ===

    /**
     * Run a schedule immediately, outside the polling cycle.
     * A failed run is returned as a FAILED execution rather than thrown.
     *
     * @throws IllegalStateException if the schedule already has a running execution
     */
    public ExecutionResponse executeNow(UUID scheduleId) {
        var schedule = findSchedule(scheduleId);

        if (executionTracker.isRunning(scheduleId)) {
            throw new IllegalStateException("Schedule " + scheduleId + " already has a running execution");
        }

        log.info("Manual execution requested for schedule {}", scheduleId);
        try {
            return scheduleMapper.toExecutionResponse(executionRunner.execute(schedule, Instant.now()));
        } catch (ScheduleExecutionException e) {
            return executionRepository.findById(e.getExecutionId())
                    .map(scheduleMapper::toExecutionResponse)
                    .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ExecutionStatusResponse> getLatestExecutionStatus(UUID scheduleId) {
        findSchedule(scheduleId);
        return executionTracker.findLatest(scheduleId).map(ScheduleManagementService::toStatusResponse);
    }

    // === Validation ===

    @Transactional(readOnly = true)
    public ValidationResult validateConfiguration(CreateScheduleRequest request, UUID excludeScheduleId) {
        return scheduleValidator.validate(toDefinition(request), excludeScheduleId);
    }

    @Transactional(readOnly = true)
    public ConflictCheckResponse checkConflicts(ConflictCheckRequest request) {
        var definition = ScheduleDefinition.builder()
                .ownerId(request.getOwnerId())
                .accountId(request.getAccountId())
                .type(request.getType())
                .dateRangeFrom(request.getDateRangeFrom())
                .dateRangeTo(request.getDateRangeTo())
                .cronExpression(request.getCronExpression())
                .timezone(normalizeTimezone(request.getTimezone()))
                .specificDates(request.getSpecificDates() != null ? request.getSpecificDates() : List.of())
                .build();

        var conflicts = conflictChecker.findConflicts(definition, request.getExcludeScheduleId(), Instant.now());
        return ConflictCheckResponse.builder()
                .hasConflicts(!conflicts.isEmpty())
                .conflicts(conflicts)
                .build();
    }

    // === Calendar ===

    /**
     * Upcoming occurrences of every enabled recurring schedule.
     * A schedule whose expression cannot be evaluated is listed with an error.
     */
    @Transactional(readOnly = true)
    public List<CalendarEntry> getCalendar(Integer occurrences) {
        var count = occurrences != null ? occurrences : properties.getCalendarOccurrences();
        var now = Instant.now();

        return scheduleRepository.findEnabledRecurringSchedules().stream()
                .map(schedule -> {
                    var entry = CalendarEntry.builder()
                            .scheduleId(schedule.getId())
                            .scheduleName(schedule.getName())
                            .ownerId(schedule.getOwnerId())
                            .accountId(schedule.getAccountId())
                            .cronExpression(schedule.getCronExpression())
                            .timezone(schedule.getTimezone());
                    try {
                        entry.occurrences(nextRunCalculator.upcomingOccurrences(
                                schedule.getCronExpression(), schedule.getTimezone(), now, count));
                    } catch (RecurrenceParseException e) {
                        log.warn("Skipping occurrences of schedule {}: {}", schedule.getId(), e.getMessage());
                        entry.occurrences(List.of()).error(e.getMessage());
                    }
                    return entry.build();
                })
                .toList();
    }

    // === Bulk Operations ===

    /**
     * Enable or disable several schedules. Each schedule is saved on its own; failures are reported per item.
     * Re-enabled schedules are validated first, so one that now conflicts stays disabled.
     */
    public BulkOperationResult bulkSetEnabled(List<UUID> scheduleIds, boolean enabled) {
        var result = BulkOperationResult.builder().build();
        var now = Instant.now();

        for (var scheduleId : scheduleIds) {
            try {
                var schedule = findSchedule(scheduleId);
                if (enabled && !schedule.isEnabled()) {
                    var definition = schedule.toDefinition().toBuilder().enabled(true).build();
                    rejectIfInvalid(scheduleValidator.validate(definition, scheduleId, now));
                    schedule.setNextExecutionAt(nextRunCalculator.calculateNextExecution(schedule.toDefinition(), now).orElse(null));
                }
                schedule.setEnabled(enabled);
                scheduleRepository.save(schedule);
                result.getUpdated().add(scheduleId);
            } catch (Exception e) {
                log.warn("Failed to set enabled={} on schedule {}: {}", enabled, scheduleId, e.getMessage());
                result.getErrors().add(BulkOperationResult.ItemError.builder()
                        .scheduleId(scheduleId)
                        .error(e.getMessage())
                        .build());
            }
        }

        log.info("Bulk set enabled={} on {} schedules, {} failed", enabled, result.getUpdated().size(), result.getErrors().size());
        return result;
    }

    // === Analytics ===

    @Transactional(readOnly = true)
    public ScheduleAnalytics getAnalytics(String ownerId) {
        var now = Instant.now();
        var scheduleIds = scheduleRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(ProcessingSchedule::getId)
                .toList();

        var analytics = ScheduleAnalytics.builder()
                .ownerId(ownerId)
                .totalSchedules(scheduleIds.size())
                .activeSchedules(scheduleRepository.countByOwnerIdAndEnabledTrue(ownerId))
                .recentExecutions(List.of())
                .generatedAt(now);

        if (scheduleIds.isEmpty()) {
            return analytics.build();
        }

        var total = executionRepository.countByScheduleIdIn(scheduleIds);
        var successful = executionRepository.countByScheduleIdInAndStatus(scheduleIds, ExecutionStatus.COMPLETED);
        var failed = executionRepository.countByScheduleIdInAndStatus(scheduleIds, ExecutionStatus.FAILED);
        var averageMs = executionRepository.averageProcessingDurationMs(scheduleIds);
        var startOfDay = now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
        var recent = executionRepository.findByScheduleIdInOrderByStartedAtDesc(scheduleIds,
                PageRequest.of(0, ANALYTICS_RECENT_EXECUTIONS));

        return analytics
                .totalExecutions(total)
                .successfulExecutions(successful)
                .failedExecutions(failed)
                .successRate(total > 0 ? successful * 100.0 / total : 0.0)
                .averageProcessingTimeMs(averageMs != null ? Math.round(averageMs) : 0L)
                .emailsProcessedToday(executionRepository.sumProcessedEmailsSince(scheduleIds, startOfDay))
                .emailsProcessedThisWeek(executionRepository.sumProcessedEmailsSince(scheduleIds, now.minus(Duration.ofDays(7))))
                .emailsProcessedThisMonth(executionRepository.sumProcessedEmailsSince(scheduleIds, now.minus(Duration.ofDays(30))))
                .recentExecutions(scheduleMapper.toExecutionResponses(recent))
                .build();
    }

    // === Helpers ===

    private ProcessingSchedule findSchedule(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    private static void rejectIfInvalid(ValidationResult validation) {
        if (validation.isValid()) {
            return;
        }
        if (validation.hasConflicts()) {
            throw new ScheduleConflictException(validation);
        }
        throw new ScheduleValidationException(validation);
    }

    private ScheduleDefinition toDefinition(CreateScheduleRequest request) {
        return ScheduleDefinition.builder()
                .ownerId(request.getOwnerId())
                .accountId(request.getAccountId())
                .type(request.getType())
                .dateRangeFrom(request.getDateRangeFrom())
                .dateRangeTo(request.getDateRangeTo())
                .cronExpression(request.getCronExpression())
                .timezone(normalizeTimezone(request.getTimezone()))
                .specificDates(request.getSpecificDates() != null ? request.getSpecificDates() : List.of())
                .batchSize(request.getBatchSize() != null ? request.getBatchSize() : properties.getDefaultBatchSize())
                .categoryPriorities(nonNull(request.getCategoryPriorities()))
                .senderPriorities(nonNull(request.getSenderPriorities()))
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build();
    }

    private ScheduleDefinition mergeDefinition(ScheduleDefinition current, UpdateScheduleRequest request) {
        var merged = current.toBuilder();
        if (request.getType() != null) {
            merged.type(request.getType());
        }
        if (request.getDateRangeFrom() != null) {
            merged.dateRangeFrom(request.getDateRangeFrom());
        }
        if (request.getDateRangeTo() != null) {
            merged.dateRangeTo(request.getDateRangeTo());
        }
        if (request.getCronExpression() != null) {
            merged.cronExpression(request.getCronExpression());
        }
        merged.timezone(normalizeTimezone(request.getTimezone() != null ? request.getTimezone() : current.getTimezone()));
        if (request.getSpecificDates() != null) {
            merged.clearSpecificDates().specificDates(request.getSpecificDates());
        }
        if (request.getBatchSize() != null) {
            merged.batchSize(request.getBatchSize());
        }
        if (request.getCategoryPriorities() != null) {
            merged.clearCategoryPriorities().categoryPriorities(request.getCategoryPriorities());
        }
        if (request.getSenderPriorities() != null) {
            merged.clearSenderPriorities().senderPriorities(request.getSenderPriorities());
        }
        if (request.getEnabled() != null) {
            merged.enabled(request.getEnabled());
        }
        return merged.build();
    }

    private static String normalizeTimezone(String timezone) {
        return timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
    }

    private static Map<String, String> nonNull(Map<String, String> priorities) {
        return priorities != null ? priorities : Map.of();
    }

    private static ExecutionStatusResponse toStatusResponse(ScheduleExecution execution) {
        var response = ExecutionStatusResponse.builder()
                .scheduleId(execution.getScheduleId())
                .executionId(execution.getId())
                .status(execution.getStatus())
                .progress(ExecutionStatusResponse.Progress.builder()
                        .totalBatches(valueOf(execution.getTotalBatches()))
                        .completedBatches(valueOf(execution.getCompletedBatches()))
                        .totalEmails(valueOf(execution.getTotalEmails()))
                        .processedEmails(valueOf(execution.getProcessedEmails()))
                        .failedEmails(valueOf(execution.getFailedEmails()))
                        .percent(execution.getProgressPercent())
                        .build())
                .timing(ExecutionStatusResponse.Timing.builder()
                        .scheduledFor(execution.getScheduledFor())
                        .startedAt(execution.getStartedAt())
                        .completedAt(execution.getCompletedAt())
                        .durationMs(execution.getProcessingDurationMs())
                        .build());

        if (execution.getStatus() == ExecutionStatus.FAILED) {
            response.error(ExecutionStatusResponse.Failure.builder()
                    .message(execution.getErrorMessage())
                    .details(execution.getErrorDetails())
                    .build());
        }
        return response.build();
    }

    private static int valueOf(Integer value) {
        return value != null ? value : 0;
    }
}
