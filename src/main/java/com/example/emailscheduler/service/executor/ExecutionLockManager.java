package com.example.emailscheduler.service.executor;

import com.example.emailscheduler.config.MetricsConfig;
import com.example.emailscheduler.config.SchedulerInstance;
import com.example.emailscheduler.domain.entity.ExecutionLock;
import com.example.emailscheduler.domain.repository.ExecutionLockRepository;
import com.example.emailscheduler.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.UUID;

/**
 * Claims due instants across scheduler instances.
 * <p>
 * A claim is a row in execution_locks keyed by the exact instant. The insert
 * runs in its own transaction and either commits or fails on the unique
 * constraint, so concurrent claims for one instant leave exactly one row.
 * There is no lease: a claim lasts until {@link #release(Instant)} deletes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLockManager {

    private final ExecutionLockRepository lockRepository;
    private final SchedulerInstance schedulerInstance;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;

    /**
     * Try to claim an instant for this instance.
     *
     * @return true if this instance now owns the instant, false if another instance already does
     */
    public boolean acquire(Instant executionTime, Collection<UUID> scheduleIds) {
        var lock = ExecutionLock.builder()
                .executionTime(executionTime)
                .scheduleIds(new ArrayList<>(scheduleIds.stream().map(UUID::toString).toList()))
                .locked(true)
                .lockedBy(schedulerInstance.getId())
                .build();

        try {
            lockRepository.saveAndFlush(lock);
            metricsConfig.recordLockAcquired();
            log.debug("Acquired execution lock for {} covering {} schedules", executionTime, scheduleIds.size());
            return true;
        } catch (DataIntegrityViolationException e) {
            metricsConfig.recordLockContention();
            log.warn("Execution lock for {} is held by another instance, skipping group", executionTime);
            return false;
        }
    }

    /**
     * Delete the claim on an instant. Failures are reported, never thrown.
     */
    public void release(Instant executionTime) {
        try {
            var deleted = lockRepository.deleteByExecutionTime(executionTime);
            if (deleted == 0) {
                log.warn("No execution lock found for {} on release", executionTime);
            } else {
                log.debug("Released execution lock for {}", executionTime);
            }
        } catch (DataAccessException e) {
            log.error("Failed to release execution lock for {}: {}", executionTime, e.getMessage(), e);
            metricsConfig.recordLockReleaseFailure();
            slackAlertService.sendLockReleaseFailedAlert(executionTime, e.getMessage());
        }
    }
}
