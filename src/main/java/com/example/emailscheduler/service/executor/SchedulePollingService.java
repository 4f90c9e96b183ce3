package com.example.emailscheduler.service.executor;

import com.example.emailscheduler.config.MetricsConfig;
import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.repository.ProcessingScheduleRepository;
import com.example.emailscheduler.exception.ScheduleExecutionException;
import com.example.emailscheduler.service.executor.GroupExecutionResult.MemberOutcome;
import com.example.emailscheduler.service.executor.GroupExecutionResult.MemberStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Discovers due schedules and runs them, grouped by due instant.
 * <p>
 * Every instance polls. The execution lock on a group's instant decides which
 * instance runs that group, so no job-level lock is taken here.
 * <p>
 * Flow:
 * 1. Load enabled schedules due at or before now
 * 2. Group them by their exact due instant, earliest first
 * 3. For each group, claim the instant or skip the group if another instance holds it
 * 4. Run all members concurrently and wait for every one of them to settle
 * 5. Release the claim
 */
@Slf4j
@Service
public class SchedulePollingService {

    private final ProcessingScheduleRepository scheduleRepository;
    private final ScheduleExecutionRunner executionRunner;
    private final ExecutionLockManager lockManager;
    private final ExecutionTracker executionTracker;
    private final MetricsConfig metricsConfig;
    private final ExecutorService scheduleExecutor;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public SchedulePollingService(ProcessingScheduleRepository scheduleRepository, ScheduleExecutionRunner executionRunner,
                                  ExecutionLockManager lockManager, ExecutionTracker executionTracker,
                                  MetricsConfig metricsConfig,
                                  @Qualifier("scheduleExecutor") ExecutorService scheduleExecutor) {
        this.scheduleRepository = scheduleRepository;
        this.executionRunner = executionRunner;
        this.lockManager = lockManager;
        this.executionTracker = executionTracker;
        this.metricsConfig = metricsConfig;
        this.scheduleExecutor = scheduleExecutor;
    }

    /**
     * Polling tick. A tick that starts while the previous one is still running is skipped.
     */
    @Scheduled(fixedDelayString = "${email-scheduler.poll-interval-ms:60000}")
    public void pollAndExecuteDueSchedules() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return;
        }

        try {
            var now = Instant.now();
            var dueSchedules = scheduleRepository.findDueSchedules(now);

            if (dueSchedules.isEmpty()) {
                log.debug("No schedules due at {}", now);
                return;
            }

            var groups = groupByExecutionTime(dueSchedules);
            log.info("Found {} due schedules in {} execution groups", dueSchedules.size(), groups.size());

            groups.forEach(this::executeGroup);
        } catch (Exception e) {
            log.error("Error in schedule polling cycle: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Partition schedules by their exact due instant, ordered by instant.
     */
    public SortedMap<Instant, List<ProcessingSchedule>> groupByExecutionTime(List<ProcessingSchedule> schedules) {
        var groups = new TreeMap<Instant, List<ProcessingSchedule>>();
        for (var schedule : schedules) {
            groups.computeIfAbsent(schedule.getNextExecutionAt(), instant -> new ArrayList<>()).add(schedule);
        }
        return groups;
    }

    /**
     * Run one group under the execution lock for its instant.
     * A failing member never stops its siblings, and the lock is released however the group ends.
     */
    public GroupExecutionResult executeGroup(Instant executionTime, List<ProcessingSchedule> schedules) {
        var scheduleIds = schedules.stream().map(ProcessingSchedule::getId).toList();

        if (!lockManager.acquire(executionTime, scheduleIds)) {
            return GroupExecutionResult.skipped(executionTime);
        }

        try {
            var futures = schedules.stream()
                    .map(schedule -> CompletableFuture
                            .supplyAsync(() -> runMember(schedule, executionTime), scheduleExecutor)
                            .handle((outcome, error) -> error == null ? outcome : failedOutcome(schedule, error)))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            var outcomes = futures.stream().map(CompletableFuture::join).toList();
            var result = GroupExecutionResult.builder()
                    .executionTime(executionTime)
                    .lockAcquired(true)
                    .members(outcomes)
                    .build();

            metricsConfig.recordGroupExecuted(schedules.size());
            log.info("Execution group {} finished: {} succeeded, {} failed, {} skipped", executionTime,
                    result.countByStatus(MemberStatus.SUCCEEDED),
                    result.countByStatus(MemberStatus.FAILED),
                    result.countByStatus(MemberStatus.SKIPPED));
            return result;
        } finally {
            lockManager.release(executionTime);
        }
    }

    /**
     * Re-read the schedule before running it: another tick or a manual run may
     * already have moved it past this instant, or may still be running it.
     */
    private MemberOutcome runMember(ProcessingSchedule snapshot, Instant executionTime) {
        var current = scheduleRepository.findById(snapshot.getId()).orElse(null);
        if (current == null || !current.isDueAt(executionTime) || !executionTime.equals(current.getNextExecutionAt())) {
            log.info("Schedule {} is no longer due at {}, skipping", snapshot.getId(), executionTime);
            return skippedOutcome(snapshot);
        }
        if (executionTracker.isRunning(current.getId())) {
            log.info("Schedule {} already has a running execution, skipping {}", current.getId(), executionTime);
            return skippedOutcome(snapshot);
        }

        var execution = executionRunner.execute(current, executionTime);
        return MemberOutcome.builder()
                .scheduleId(current.getId())
                .status(MemberStatus.SUCCEEDED)
                .executionId(execution.getId())
                .build();
    }

    private static MemberOutcome skippedOutcome(ProcessingSchedule schedule) {
        return MemberOutcome.builder()
                .scheduleId(schedule.getId())
                .status(MemberStatus.SKIPPED)
                .build();
    }

    private MemberOutcome failedOutcome(ProcessingSchedule schedule, Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.error("Schedule {} failed in execution group {}: {}",
                schedule.getId(), schedule.getNextExecutionAt(), cause.getMessage());

        var builder = MemberOutcome.builder()
                .scheduleId(schedule.getId())
                .status(MemberStatus.FAILED)
                .error(cause.getMessage());
        if (cause instanceof ScheduleExecutionException executionException) {
            builder.executionId(executionException.getExecutionId());
        }
        return builder.build();
    }
}
