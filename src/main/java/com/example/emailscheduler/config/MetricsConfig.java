package com.example.emailscheduler.config;

import com.example.emailscheduler.domain.enums.ExecutionStatus;
import com.example.emailscheduler.domain.enums.ScheduleType;
import com.example.emailscheduler.domain.repository.ExecutionLockRepository;
import com.example.emailscheduler.domain.repository.ProcessingScheduleRepository;
import com.example.emailscheduler.domain.repository.ScheduleExecutionRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring scheduler health and performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Enabled and due schedules
 * - Running executions and held execution locks
 * - Execution times by schedule type and outcome
 * - Lock contention and release failures
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private static final String PREFIX = "email_scheduler_";

    private final MeterRegistry meterRegistry;
    private final ProcessingScheduleRepository scheduleRepository;
    private final ScheduleExecutionRepository executionRepository;
    private final ExecutionLockRepository lockRepository;

    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        registerGauge("schedules_enabled", "Number of enabled schedules");
        registerGauge("schedules_due", "Number of enabled schedules whose next execution has passed");
        registerGauge("executions_running", "Number of executions currently running");
        registerGauge("execution_locks_held", "Number of execution locks currently held");
        registerGauge("execution_locks_stale", "Number of execution locks older than the stale threshold");
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${email-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        gauges.get("schedules_enabled").set(scheduleRepository.countByEnabledTrue());
        gauges.get("schedules_due").set(scheduleRepository.countDueSchedules(Instant.now()));
        gauges.get("executions_running").set(executionRepository.countByStatus(ExecutionStatus.RUNNING));
        gauges.get("execution_locks_held").set(lockRepository.count());
    }

    public void setStaleLockCount(long count) {
        gauges.get("execution_locks_stale").set(count);
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordExecution(Timer.Sample sample, ScheduleType type, boolean success) {
        sample.stop(Timer.builder(PREFIX + "execution_time")
                .tag("type", type.name().toLowerCase())
                .tag("success", String.valueOf(success))
                .description("Schedule execution time")
                .register(meterRegistry));
    }

    public void recordExecutionFailure(ScheduleType type, String errorType) {
        meterRegistry.counter(PREFIX + "execution_failures",
                "type", type.name().toLowerCase(),
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordLockAcquired() {
        meterRegistry.counter(PREFIX + "lock_acquired").increment();
    }

    public void recordLockContention() {
        meterRegistry.counter(PREFIX + "lock_contention").increment();
    }

    public void recordLockReleaseFailure() {
        meterRegistry.counter(PREFIX + "lock_release_failures").increment();
    }

    public void recordGroupExecuted(int size) {
        meterRegistry.summary(PREFIX + "group_size").record(size);
    }

    private void registerGauge(String name, String description) {
        var value = new AtomicLong(0);
        gauges.put(name, value);
        Gauge.builder(PREFIX + name, value, AtomicLong::get)
                .description(description)
                .register(meterRegistry);
    }
}
