package com.example.emailscheduler.service.executor;

import com.example.emailscheduler.config.EmailSchedulerProperties;
import com.example.emailscheduler.config.MetricsConfig;
import com.example.emailscheduler.domain.entity.ExecutionLock;
import com.example.emailscheduler.domain.repository.ExecutionLockRepository;
import com.example.emailscheduler.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Periodic check for execution locks older than the stale threshold.
 * <p>
 * A lock outlives its group only when the holding instance died or its release
 * failed. Stale locks are always reported. They are deleted only when
 * {@code email-scheduler.stale-lock-reclaim-enabled} is set, because a group
 * that is merely slow would otherwise be run twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLockSweeper {

    private final ExecutionLockRepository lockRepository;
    private final EmailSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;

    @Scheduled(fixedDelayString = "${email-scheduler.stale-lock-check-interval-ms:300000}")
    @SchedulerLock(name = "staleExecutionLockCheck", lockAtLeastFor = "30s", lockAtMostFor = "5m")
    public void inspectStaleLocks() {
        try {
            var threshold = Instant.now().minusSeconds(properties.getStaleLockThresholdMinutes() * 60L);
            var staleLocks = lockRepository.findByCreatedAtBefore(threshold);
            metricsConfig.setStaleLockCount(staleLocks.size());

            if (staleLocks.isEmpty()) {
                log.debug("No stale execution locks found");
                return;
            }

            var instants = staleLocks.stream()
                    .map(lock -> lock.getExecutionTime() + " by " + lock.getLockedBy())
                    .collect(Collectors.joining(", "));

            if (!properties.isStaleLockReclaimEnabled()) {
                log.error("Found {} stale execution locks: {}", staleLocks.size(), instants);
                slackAlertService.sendStaleLocksAlert(staleLocks, false);
                return;
            }

            var reclaimed = 0;
            for (ExecutionLock lock : staleLocks) {
                reclaimed += lockRepository.deleteByExecutionTime(lock.getExecutionTime());
            }
            metricsConfig.setStaleLockCount(staleLocks.size() - reclaimed);
            log.warn("Reclaimed {} of {} stale execution locks: {}", reclaimed, staleLocks.size(), instants);
            slackAlertService.sendStaleLocksAlert(staleLocks, true);
        } catch (Exception e) {
            log.error("Error checking stale execution locks: {}", e.getMessage(), e);
        }
    }
}
