package com.example.emailscheduler.service;

import com.example.emailscheduler.config.EmailSchedulerProperties;
import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.entity.ScheduleExecution;
import com.example.emailscheduler.domain.enums.ExecutionStatus;
import com.example.emailscheduler.domain.enums.ScheduleType;
import com.example.emailscheduler.domain.model.ScheduleDefinition;
import com.example.emailscheduler.domain.repository.ProcessingScheduleRepository;
import com.example.emailscheduler.domain.repository.ScheduleExecutionRepository;
import com.example.emailscheduler.dto.CreateScheduleRequest;
import com.example.emailscheduler.dto.ExecutionResponse;
import com.example.emailscheduler.dto.ScheduleConflict;
import com.example.emailscheduler.dto.ScheduleResponse;
import com.example.emailscheduler.dto.UpdateScheduleRequest;
import com.example.emailscheduler.dto.ValidationResult;
import com.example.emailscheduler.exception.ScheduleConflictException;
import com.example.emailscheduler.exception.ScheduleExecutionException;
import com.example.emailscheduler.exception.ScheduleNotFoundException;
import com.example.emailscheduler.exception.ScheduleValidationException;
import com.example.emailscheduler.mapper.ScheduleMapper;
import com.example.emailscheduler.service.executor.ExecutionTracker;
import com.example.emailscheduler.service.executor.ScheduleExecutionRunner;
import com.example.emailscheduler.service.recurrence.CronRecurrenceStrategy;
import com.example.emailscheduler.service.recurrence.NextRunCalculator;
import com.example.emailscheduler.service.validation.ScheduleConflictChecker;
import com.example.emailscheduler.service.validation.ScheduleValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduleManagementService Tests")
class ScheduleManagementServiceTest {

    @Mock
    private ProcessingScheduleRepository scheduleRepository;

    @Mock
    private ScheduleExecutionRepository executionRepository;

    @Mock
    private ScheduleValidator scheduleValidator;

    @Mock
    private ScheduleConflictChecker conflictChecker;

    @Mock
    private ExecutionTracker executionTracker;

    @Mock
    private ScheduleExecutionRunner executionRunner;

    @Mock
    private ScheduleMapper scheduleMapper;

    @Captor
    private ArgumentCaptor<ProcessingSchedule> scheduleCaptor;

    private ScheduleManagementService managementService;

    private UUID scheduleId;
    private ProcessingSchedule dailySchedule;

    @BeforeEach
    void setUp() {
        managementService = new ScheduleManagementService(scheduleRepository, executionRepository, scheduleValidator,
                conflictChecker, new NextRunCalculator(new CronRecurrenceStrategy()), executionTracker, executionRunner,
                scheduleMapper, new EmailSchedulerProperties());

        scheduleId = UUID.randomUUID();
        dailySchedule = ProcessingSchedule.builder()
                .id(scheduleId)
                .ownerId("owner-1")
                .accountId("account-1")
                .name("Daily digest")
                .type(ScheduleType.RECURRING)
                .cronExpression("0 6 * * *")
                .nextExecutionAt(Instant.now().plus(1, ChronoUnit.HOURS))
                .createdAt(Instant.now().minus(5, ChronoUnit.DAYS))
                .build();

        lenient().when(scheduleMapper.toResponse(any(ProcessingSchedule.class))).thenAnswer(invocation -> {
            ProcessingSchedule schedule = invocation.getArgument(0);
            return ScheduleResponse.builder()
                    .id(schedule.getId())
                    .name(schedule.getName())
                    .type(schedule.getType())
                    .enabled(schedule.isEnabled())
                    .nextExecutionAt(schedule.getNextExecutionAt())
                    .build();
        });
    }

    private static ValidationResult valid(String... warnings) {
        return ValidationResult.builder().valid(true).warnings(new ArrayList<>(List.of(warnings))).build();
    }

    private static CreateScheduleRequest recurringRequest() {
        return CreateScheduleRequest.builder()
                .ownerId("owner-1")
                .accountId("account-1")
                .name("Morning run")
                .type(ScheduleType.RECURRING)
                .cronExpression("0 6 * * *")
                .build();
    }

    @Nested
    @DisplayName("Schedule Creation Tests")
    class CreationTests {

        @Test
        @DisplayName("Should create a schedule with its first due instant")
        void shouldCreateSchedule() {
            // Given
            var request = recurringRequest();
            when(scheduleRepository.existsByOwnerIdAndName("owner-1", "Morning run")).thenReturn(false);
            when(scheduleValidator.validate(any(ScheduleDefinition.class), isNull(), any(Instant.class)))
                    .thenReturn(valid("Recurring schedule runs more than 24 times a day"));
            when(scheduleMapper.toEntity(request)).thenReturn(ProcessingSchedule.builder()
                    .ownerId("owner-1")
                    .accountId("account-1")
                    .name("Morning run")
                    .type(ScheduleType.RECURRING)
                    .cronExpression("0 6 * * *")
                    .batchSize(null)
                    .build());
            when(scheduleRepository.save(any(ProcessingSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            var response = managementService.createSchedule(request);

            // Then
            verify(scheduleRepository).save(scheduleCaptor.capture());
            var saved = scheduleCaptor.getValue();
            assertThat(saved.getTimezone()).isEqualTo("UTC");
            assertThat(saved.getBatchSize()).isEqualTo(5);
            assertThat(saved.getNextExecutionAt()).isAfter(Instant.now());
            assertThat(saved.getNextExecutionAt().atZone(ZoneOffset.UTC).getHour()).isEqualTo(6);
            assertThat(saved.getCreatedAt()).isNotNull();
            assertThat(response.getWarnings()).containsExactly("Recurring schedule runs more than 24 times a day");
        }

        @Test
        @DisplayName("Should reject a duplicate name for the same owner")
        void shouldRejectDuplicateName() {
            when(scheduleRepository.existsByOwnerIdAndName("owner-1", "Morning run")).thenReturn(true);

            assertThatThrownBy(() -> managementService.createSchedule(recurringRequest()))
                    .isInstanceOf(ScheduleValidationException.class)
                    .hasMessageContaining("Morning run");

            verify(scheduleRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject an invalid configuration without saving")
        void shouldRejectInvalidConfiguration() {
            when(scheduleValidator.validate(any(ScheduleDefinition.class), isNull(), any(Instant.class)))
                    .thenReturn(ValidationResult.invalid("Cron expression is required for RECURRING schedules"));

            assertThatThrownBy(() -> managementService.createSchedule(recurringRequest()))
                    .isInstanceOf(ScheduleValidationException.class);

            verify(scheduleRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject a conflicting schedule with a conflict error")
        void shouldRejectConflict() {
            // Given
            var conflict = ScheduleConflict.builder()
                    .conflictTime(Instant.now().plus(1, ChronoUnit.DAYS))
                    .reason("Another schedule of account account-1 runs at the same time")
                    .conflictingScheduleIds(List.of(scheduleId))
                    .build();
            when(scheduleValidator.validate(any(ScheduleDefinition.class), isNull(), any(Instant.class)))
                    .thenReturn(ValidationResult.builder().valid(false).conflicts(new ArrayList<>(List.of(conflict))).build());

            // When / Then
            assertThatThrownBy(() -> managementService.createSchedule(recurringRequest()))
                    .isInstanceOf(ScheduleConflictException.class);
            verify(scheduleRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Default Schedule Tests")
    class DefaultScheduleTests {

        @Test
        @DisplayName("Should create a disabled look-back schedule for a new account")
        void shouldCreateDefaultSchedule() {
            // Given
            when(scheduleRepository.findFirstByOwnerIdAndAccountIdAndDefaultScheduleTrue("owner-1", "account-1"))
                    .thenReturn(Optional.empty());
            when(scheduleRepository.save(any(ProcessingSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            managementService.createDefaultSchedule("owner-1", "account-1");

            // Then
            verify(scheduleRepository).save(scheduleCaptor.capture());
            var saved = scheduleCaptor.getValue();
            assertThat(saved.getName()).isEqualTo("Initial - account-1");
            assertThat(saved.getType()).isEqualTo(ScheduleType.DATE_RANGE);
            assertThat(saved.isEnabled()).isFalse();
            assertThat(saved.isDefaultSchedule()).isTrue();
            assertThat(ChronoUnit.DAYS.between(saved.getDateRangeFrom(), saved.getDateRangeTo())).isEqualTo(30);
            assertThat(saved.getCategoryPriorities())
                    .containsEntry("APPOINTMENT", "HIGH")
                    .containsEntry("INVOICE", "HIGH")
                    .containsEntry("WORK", "MEDIUM");
        }

        @Test
        @DisplayName("Should return the existing default schedule")
        void shouldReturnExistingDefault() {
            when(scheduleRepository.findFirstByOwnerIdAndAccountIdAndDefaultScheduleTrue("owner-1", "account-1"))
                    .thenReturn(Optional.of(dailySchedule));

            var response = managementService.createDefaultSchedule("owner-1", "account-1");

            assertThat(response.getId()).isEqualTo(scheduleId);
            verify(scheduleRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Schedule Update Tests")
    class UpdateTests {

        @Test
        @DisplayName("Should recompute the due instant when the cron expression changes")
        void shouldRecomputeOnTimingChange() {
            // Given
            var request = UpdateScheduleRequest.builder().cronExpression("0 8 * * *").build();
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.of(dailySchedule));
            when(scheduleValidator.validate(any(ScheduleDefinition.class), eq(scheduleId), any(Instant.class)))
                    .thenReturn(valid());
            when(scheduleRepository.save(any(ProcessingSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            var response = managementService.updateSchedule(scheduleId, request);

            // Then
            assertThat(response.getNextExecutionAt().atZone(ZoneOffset.UTC).getHour()).isEqualTo(8);
            verify(scheduleMapper).updateEntity(request, dailySchedule);
        }

        @Test
        @DisplayName("Should leave timing alone for a description change")
        void shouldNotRevalidateCosmeticChange() {
            var previousNext = dailySchedule.getNextExecutionAt();
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.of(dailySchedule));
            when(scheduleRepository.save(any(ProcessingSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));

            managementService.updateSchedule(scheduleId, UpdateScheduleRequest.builder().description("New text").build());

            assertThat(dailySchedule.getNextExecutionAt()).isEqualTo(previousNext);
            verify(scheduleValidator, never()).validate(any(), any(), any());
        }

        @Test
        @DisplayName("Should recompute the due instant when re-enabling")
        void shouldRecomputeOnReenable() {
            // Given
            dailySchedule.setEnabled(false);
            dailySchedule.setNextExecutionAt(Instant.now().minus(10, ChronoUnit.DAYS));
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.of(dailySchedule));
            when(scheduleValidator.validate(any(ScheduleDefinition.class), eq(scheduleId), any(Instant.class)))
                    .thenReturn(valid());
            when(scheduleRepository.save(any(ProcessingSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            managementService.updateSchedule(scheduleId, UpdateScheduleRequest.builder().enabled(true).build());

            // Then
            assertThat(dailySchedule.getNextExecutionAt()).isAfter(Instant.now());
        }

        @Test
        @DisplayName("Should throw when the schedule does not exist")
        void shouldThrowWhenMissing() {
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> managementService.updateSchedule(scheduleId, new UpdateScheduleRequest()))
                    .isInstanceOf(ScheduleNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Execution Tests")
    class ExecutionTests {

        @Test
        @DisplayName("Should refuse to run a schedule that is already running")
        void shouldRefuseConcurrentRun() {
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.of(dailySchedule));
            when(executionTracker.isRunning(scheduleId)).thenReturn(true);

            assertThatThrownBy(() -> managementService.executeNow(scheduleId))
                    .isInstanceOf(IllegalStateException.class);
            verify(executionRunner, never()).execute(any(), any());
        }

        @Test
        @DisplayName("Should return the failed execution instead of throwing")
        void shouldReturnFailedExecution() {
            // Given
            var executionId = UUID.randomUUID();
            var failed = ScheduleExecution.builder().id(executionId).scheduleId(scheduleId).status(ExecutionStatus.FAILED).build();
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.of(dailySchedule));
            when(executionTracker.isRunning(scheduleId)).thenReturn(false);
            when(executionRunner.execute(eq(dailySchedule), any(Instant.class)))
                    .thenThrow(new ScheduleExecutionException(scheduleId, executionId, new IllegalStateException("boom")));
            when(executionRepository.findById(executionId)).thenReturn(Optional.of(failed));
            when(scheduleMapper.toExecutionResponse(failed))
                    .thenReturn(ExecutionResponse.builder().id(executionId).status(ExecutionStatus.FAILED).build());

            // When
            var response = managementService.executeNow(scheduleId);

            // Then
            assertThat(response.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(response.getId()).isEqualTo(executionId);
        }
    }

    @Nested
    @DisplayName("Calendar Tests")
    class CalendarTests {

        @Test
        @DisplayName("Should list occurrences and flag schedules that cannot be evaluated")
        void shouldListOccurrences() {
            // Given
            var broken = ProcessingSchedule.builder()
                    .id(UUID.randomUUID())
                    .ownerId("owner-1")
                    .accountId("account-2")
                    .name("Broken")
                    .type(ScheduleType.RECURRING)
                    .cronExpression("every morning")
                    .build();
            when(scheduleRepository.findEnabledRecurringSchedules()).thenReturn(List.of(dailySchedule, broken));

            // When
            var calendar = managementService.getCalendar(3);

            // Then
            assertThat(calendar).hasSize(2);
            assertThat(calendar.get(0).getOccurrences()).hasSize(3);
            assertThat(calendar.get(0).getError()).isNull();
            assertThat(calendar.get(1).getOccurrences()).isEmpty();
            assertThat(calendar.get(1).getError()).isNotBlank();
        }
    }

    @Nested
    @DisplayName("Bulk Operation Tests")
    class BulkTests {

        @Test
        @DisplayName("Should report unknown schedules without stopping the batch")
        void shouldReportPerItemErrors() {
            // Given
            var unknown = UUID.randomUUID();
            dailySchedule.setEnabled(false);
            dailySchedule.setNextExecutionAt(null);
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.of(dailySchedule));
            when(scheduleRepository.findById(unknown)).thenReturn(Optional.empty());
            when(scheduleValidator.validate(any(ScheduleDefinition.class), eq(scheduleId), any(Instant.class)))
                    .thenReturn(valid());

            // When
            var result = managementService.bulkSetEnabled(List.of(unknown, scheduleId), true);

            // Then
            assertThat(result.getUpdated()).containsExactly(scheduleId);
            assertThat(result.getErrors()).singleElement()
                    .satisfies(error -> assertThat(error.getScheduleId()).isEqualTo(unknown));
            assertThat(dailySchedule.isEnabled()).isTrue();
            assertThat(dailySchedule.getNextExecutionAt()).isNotNull();
            verify(scheduleRepository).save(dailySchedule);
        }

        @Test
        @DisplayName("Should keep a schedule disabled when re-enabling it would conflict")
        void shouldNotEnableConflictingSchedule() {
            // Given
            var strategy = new CronRecurrenceStrategy();
            var calculator = new NextRunCalculator(strategy);
            var properties = new EmailSchedulerProperties();
            var validator = new ScheduleValidator(strategy, calculator,
                    new ScheduleConflictChecker(scheduleRepository, calculator, strategy), properties);
            var service = new ScheduleManagementService(scheduleRepository, executionRepository, validator,
                    conflictChecker, calculator, executionTracker, executionRunner, scheduleMapper, properties);

            var twin = ProcessingSchedule.builder()
                    .id(UUID.randomUUID())
                    .ownerId("owner-1")
                    .accountId("account-1")
                    .name("Daily digest copy")
                    .type(ScheduleType.RECURRING)
                    .cronExpression("0 6 * * *")
                    .enabled(false)
                    .build();
            when(scheduleRepository.findById(twin.getId())).thenReturn(Optional.of(twin));
            when(scheduleRepository.findByOwnerIdAndAccountIdAndType("owner-1", "account-1", ScheduleType.RECURRING))
                    .thenReturn(List.of(dailySchedule, twin));

            // When
            var result = service.bulkSetEnabled(List.of(twin.getId()), true);

            // Then
            assertThat(result.getUpdated()).isEmpty();
            assertThat(result.getErrors()).singleElement()
                    .satisfies(error -> assertThat(error.getScheduleId()).isEqualTo(twin.getId()));
            assertThat(twin.isEnabled()).isFalse();
            assertThat(dailySchedule.isEnabled()).isTrue();
            verify(scheduleRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should disable schedules without validating them")
        void shouldDisableWithoutValidation() {
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.of(dailySchedule));

            var result = managementService.bulkSetEnabled(List.of(scheduleId), false);

            assertThat(result.getUpdated()).containsExactly(scheduleId);
            assertThat(dailySchedule.isEnabled()).isFalse();
            verify(scheduleValidator, never()).validate(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Analytics Tests")
    class AnalyticsTests {

        @Test
        @DisplayName("Should return zeros for an owner without schedules")
        void shouldReturnZerosWithoutSchedules() {
            when(scheduleRepository.findByOwnerIdOrderByCreatedAtDesc("owner-9")).thenReturn(List.of());

            var analytics = managementService.getAnalytics("owner-9");

            assertThat(analytics.getTotalSchedules()).isZero();
            assertThat(analytics.getSuccessRate()).isZero();
            verify(executionRepository, never()).countByScheduleIdIn(anyList());
        }

        @Test
        @DisplayName("Should aggregate execution counters across the owner's schedules")
        void shouldAggregateCounters() {
            // Given
            var ids = List.of(scheduleId);
            when(scheduleRepository.findByOwnerIdOrderByCreatedAtDesc("owner-1")).thenReturn(List.of(dailySchedule));
            when(scheduleRepository.countByOwnerIdAndEnabledTrue("owner-1")).thenReturn(1L);
            when(executionRepository.countByScheduleIdIn(ids)).thenReturn(4L);
            when(executionRepository.countByScheduleIdInAndStatus(ids, ExecutionStatus.COMPLETED)).thenReturn(3L);
            when(executionRepository.countByScheduleIdInAndStatus(ids, ExecutionStatus.FAILED)).thenReturn(1L);
            when(executionRepository.averageProcessingDurationMs(ids)).thenReturn(1500.4);
            when(executionRepository.sumProcessedEmailsSince(eq(ids), any(Instant.class))).thenReturn(12L);
            when(executionRepository.findByScheduleIdInOrderByStartedAtDesc(eq(ids), any())).thenReturn(List.of());
            when(scheduleMapper.toExecutionResponses(List.of())).thenReturn(List.of());

            // When
            var analytics = managementService.getAnalytics("owner-1");

            // Then
            assertThat(analytics.getTotalSchedules()).isEqualTo(1);
            assertThat(analytics.getActiveSchedules()).isEqualTo(1);
            assertThat(analytics.getSuccessRate()).isEqualTo(75.0);
            assertThat(analytics.getAverageProcessingTimeMs()).isEqualTo(1500);
            assertThat(analytics.getEmailsProcessedToday()).isEqualTo(12);
        }
    }
}
