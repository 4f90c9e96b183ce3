package com.example.emailscheduler.service.executor;

import com.example.emailscheduler.config.MetricsConfig;
import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.entity.ScheduleExecution;
import com.example.emailscheduler.domain.enums.ScheduleType;
import com.example.emailscheduler.domain.repository.ProcessingScheduleRepository;
import com.example.emailscheduler.exception.ScheduleExecutionException;
import com.example.emailscheduler.service.executor.GroupExecutionResult.MemberStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulePollingService Tests")
class SchedulePollingServiceTest {

    private static final Instant SIX_AM = Instant.parse("2024-01-02T06:00:00Z");
    private static final Instant SEVEN_AM = Instant.parse("2024-01-02T07:00:00Z");

    @Mock
    private ProcessingScheduleRepository scheduleRepository;

    @Mock
    private ScheduleExecutionRunner executionRunner;

    @Mock
    private ExecutionLockManager lockManager;

    @Mock
    private ExecutionTracker executionTracker;

    @Mock
    private MetricsConfig metricsConfig;

    private ExecutorService executor;

    private SchedulePollingService pollingService;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        pollingService = new SchedulePollingService(scheduleRepository, executionRunner, lockManager, executionTracker,
                metricsConfig, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ProcessingSchedule schedule(String name, Instant nextExecutionAt) {
        return ProcessingSchedule.builder()
                .id(UUID.randomUUID())
                .ownerId("owner-1")
                .accountId("account-" + name)
                .name(name)
                .type(ScheduleType.RECURRING)
                .cronExpression("0 * * * *")
                .nextExecutionAt(nextExecutionAt)
                .build();
    }

    private void givenStored(ProcessingSchedule schedule) {
        when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));
    }

    private static ScheduleExecution completed(ProcessingSchedule schedule) {
        return ScheduleExecution.builder().id(UUID.randomUUID()).scheduleId(schedule.getId()).build();
    }

    @Nested
    @DisplayName("groupByExecutionTime Tests")
    class GroupingTests {

        @Test
        @DisplayName("Should group schedules by exact due instant in ascending order")
        void shouldGroupByInstant() {
            // Given
            var late = schedule("late", SEVEN_AM);
            var first = schedule("first", SIX_AM);
            var second = schedule("second", SIX_AM);

            // When
            var groups = pollingService.groupByExecutionTime(List.of(late, first, second));

            // Then
            assertThat(groups.keySet()).containsExactly(SIX_AM, SEVEN_AM);
            assertThat(groups.get(SIX_AM)).containsExactly(first, second);
            assertThat(groups.get(SEVEN_AM)).containsExactly(late);
        }

        @Test
        @DisplayName("Should keep instants one second apart in separate groups")
        void shouldNotMergeNearbyInstants() {
            var groups = pollingService.groupByExecutionTime(List.of(
                    schedule("a", SIX_AM), schedule("b", SIX_AM.plusSeconds(1))));

            assertThat(groups).hasSize(2);
        }
    }

    @Nested
    @DisplayName("executeGroup Tests")
    class ExecuteGroupTests {

        @Test
        @DisplayName("Should run every member under one lock and release it")
        void shouldRunAllMembersUnderOneLock() {
            // Given
            var first = schedule("first", SIX_AM);
            var second = schedule("second", SIX_AM);
            givenStored(first);
            givenStored(second);
            when(lockManager.acquire(SIX_AM, List.of(first.getId(), second.getId()))).thenReturn(true);
            when(executionRunner.execute(first, SIX_AM)).thenReturn(completed(first));
            when(executionRunner.execute(second, SIX_AM)).thenReturn(completed(second));

            // When
            var result = pollingService.executeGroup(SIX_AM, List.of(first, second));

            // Then
            assertThat(result.isLockAcquired()).isTrue();
            assertThat(result.countByStatus(MemberStatus.SUCCEEDED)).isEqualTo(2);
            verify(lockManager, times(1)).acquire(eq(SIX_AM), anyCollection());
            verify(lockManager).release(SIX_AM);
            verify(metricsConfig).recordGroupExecuted(2);
        }

        @Test
        @DisplayName("A failing member should not stop its siblings")
        void failingMemberShouldNotStopSiblings() {
            // Given
            var failing = schedule("failing", SIX_AM);
            var healthy = schedule("healthy", SIX_AM);
            var failedExecutionId = UUID.randomUUID();
            givenStored(failing);
            givenStored(healthy);
            when(lockManager.acquire(eq(SIX_AM), anyCollection())).thenReturn(true);
            when(executionRunner.execute(failing, SIX_AM)).thenThrow(new ScheduleExecutionException(
                    failing.getId(), failedExecutionId, new IllegalStateException("mailbox unreachable")));
            when(executionRunner.execute(healthy, SIX_AM)).thenReturn(completed(healthy));

            // When
            var result = pollingService.executeGroup(SIX_AM, List.of(failing, healthy));

            // Then
            assertThat(result.countByStatus(MemberStatus.SUCCEEDED)).isEqualTo(1);
            assertThat(result.countByStatus(MemberStatus.FAILED)).isEqualTo(1);
            var failedOutcome = result.getMembers().stream()
                    .filter(member -> member.getStatus() == MemberStatus.FAILED)
                    .findFirst()
                    .orElseThrow();
            assertThat(failedOutcome.getScheduleId()).isEqualTo(failing.getId());
            assertThat(failedOutcome.getExecutionId()).isEqualTo(failedExecutionId);
            verify(lockManager).release(SIX_AM);
        }

        @Test
        @DisplayName("Should skip the group when another instance holds the lock")
        void shouldSkipWhenLockHeld() {
            var member = schedule("member", SIX_AM);
            when(lockManager.acquire(eq(SIX_AM), anyCollection())).thenReturn(false);

            var result = pollingService.executeGroup(SIX_AM, List.of(member));

            assertThat(result.isLockAcquired()).isFalse();
            assertThat(result.getMembers()).isEmpty();
            verify(executionRunner, never()).execute(any(), any());
            verify(lockManager, never()).release(any());
        }

        @Test
        @DisplayName("Should skip a member that has already moved past the instant")
        void shouldSkipMemberNoLongerDue() {
            // Given
            var member = schedule("member", SIX_AM);
            var advanced = schedule("member", SEVEN_AM);
            advanced.setId(member.getId());
            when(lockManager.acquire(eq(SIX_AM), anyCollection())).thenReturn(true);
            when(scheduleRepository.findById(member.getId())).thenReturn(Optional.of(advanced));

            // When
            var result = pollingService.executeGroup(SIX_AM, List.of(member));

            // Then
            assertThat(result.countByStatus(MemberStatus.SKIPPED)).isEqualTo(1);
            verify(executionRunner, never()).execute(any(), any());
            verify(lockManager).release(SIX_AM);
        }

        @Test
        @DisplayName("Should skip a member disabled since it was polled")
        void shouldSkipDisabledMember() {
            var member = schedule("member", SIX_AM);
            var disabled = schedule("member", SIX_AM);
            disabled.setId(member.getId());
            disabled.setEnabled(false);
            when(lockManager.acquire(eq(SIX_AM), anyCollection())).thenReturn(true);
            when(scheduleRepository.findById(member.getId())).thenReturn(Optional.of(disabled));

            var result = pollingService.executeGroup(SIX_AM, List.of(member));

            assertThat(result.countByStatus(MemberStatus.SKIPPED)).isEqualTo(1);
            verify(executionRunner, never()).execute(any(), any());
        }
    }

    @Nested
    @DisplayName("Running Execution Tests")
    class RunningExecutionTests {

        @Test
        @DisplayName("Should skip a member that a manual run is still executing")
        void shouldSkipMemberAlreadyRunning() {
            // Given
            var busy = schedule("busy", SIX_AM);
            var idle = schedule("idle", SIX_AM);
            givenStored(busy);
            givenStored(idle);
            when(lockManager.acquire(eq(SIX_AM), anyCollection())).thenReturn(true);
            when(executionTracker.isRunning(busy.getId())).thenReturn(true);
            when(executionTracker.isRunning(idle.getId())).thenReturn(false);
            when(executionRunner.execute(idle, SIX_AM)).thenReturn(completed(idle));

            // When
            var result = pollingService.executeGroup(SIX_AM, List.of(busy, idle));

            // Then
            assertThat(result.countByStatus(MemberStatus.SKIPPED)).isEqualTo(1);
            assertThat(result.countByStatus(MemberStatus.SUCCEEDED)).isEqualTo(1);
            assertThat(result.getMembers())
                    .filteredOn(member -> member.getStatus() == MemberStatus.SKIPPED)
                    .extracting(GroupExecutionResult.MemberOutcome::getScheduleId)
                    .containsExactly(busy.getId());
            verify(executionRunner, never()).execute(eq(busy), any());
            verify(lockManager).release(SIX_AM);
        }
    }

    @Nested
    @DisplayName("pollAndExecuteDueSchedules Tests")
    class PollTests {

        @Test
        @DisplayName("Should do nothing when no schedule is due")
        void shouldDoNothingWhenNothingDue() {
            when(scheduleRepository.findDueSchedules(any(Instant.class))).thenReturn(List.of());

            pollingService.pollAndExecuteDueSchedules();

            verify(lockManager, never()).acquire(any(), anyCollection());
        }

        @Test
        @DisplayName("Should claim one lock per distinct due instant")
        void shouldClaimOneLockPerInstant() {
            // Given
            var first = schedule("first", SIX_AM);
            var second = schedule("second", SIX_AM);
            var third = schedule("third", SEVEN_AM);
            when(scheduleRepository.findDueSchedules(any(Instant.class))).thenReturn(List.of(third, first, second));
            when(lockManager.acquire(eq(SIX_AM), anyCollection())).thenReturn(false);
            when(lockManager.acquire(eq(SEVEN_AM), anyCollection())).thenReturn(false);

            // When
            pollingService.pollAndExecuteDueSchedules();

            // Then
            verify(lockManager).acquire(SIX_AM, List.of(first.getId(), second.getId()));
            verify(lockManager).acquire(SEVEN_AM, List.of(third.getId()));
            verify(executionRunner, never()).execute(any(), any());
        }

        @Test
        @DisplayName("Should survive a repository failure")
        void shouldSurviveRepositoryFailure() {
            when(scheduleRepository.findDueSchedules(any(Instant.class))).thenThrow(new IllegalStateException("db down"));

            pollingService.pollAndExecuteDueSchedules();

            verify(lockManager, never()).acquire(any(), anyCollection());
        }
    }
}
