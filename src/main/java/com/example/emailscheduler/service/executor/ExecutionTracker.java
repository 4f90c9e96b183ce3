package com.example.emailscheduler.service.executor;

import com.example.emailscheduler.config.SchedulerInstance;
import com.example.emailscheduler.domain.entity.ScheduleExecution;
import com.example.emailscheduler.domain.enums.ExecutionStatus;
import com.example.emailscheduler.domain.repository.ScheduleExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle bookkeeping of execution records.
 * <p>
 * Every operation touches a single record. An execution is owned by the one
 * runner that created it, so no cross-record transaction is needed. Terminal
 * executions are never modified again: repeated completion or failure calls
 * are logged and ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionTracker {

    private static final int MAX_STACK_TRACE_LENGTH = 4000;

    private final ScheduleExecutionRepository executionRepository;
    private final SchedulerInstance schedulerInstance;

    /**
     * Create a RUNNING execution for one due instant of a schedule.
     * The attempt number counts earlier failed runs of the same instant.
     */
    @Transactional
    public ScheduleExecution createExecution(UUID scheduleId, Instant scheduledFor, int maxAttempts) {
        var previousFailures = countFailedAttempts(scheduleId, scheduledFor);

        var execution = ScheduleExecution.builder()
                .scheduleId(scheduleId)
                .status(ExecutionStatus.RUNNING)
                .scheduledFor(scheduledFor)
                .startedAt(Instant.now())
                .attemptNumber((int) previousFailures + 1)
                .maxAttempts(maxAttempts)
                .executorInstance(schedulerInstance.getId())
                .build();

        execution = executionRepository.save(execution);
        log.debug("Created execution {} for schedule {} (attempt {})", execution.getId(), scheduleId, execution.getAttemptNumber());
        return execution;
    }

    @Transactional
    public ScheduleExecution updateProgress(UUID executionId, ExecutionProgress progress) {
        var execution = getExecution(executionId);
        if (execution.getStatus().isTerminal()) {
            log.warn("Ignoring progress update for execution {} in terminal state {}", executionId, execution.getStatus());
            return execution;
        }

        applyProgress(execution, progress);
        return executionRepository.save(execution);
    }

    @Transactional
    public ScheduleExecution completeExecution(UUID executionId, ExecutionProgress summary) {
        var execution = getExecution(executionId);
        if (execution.getStatus().isTerminal()) {
            log.warn("Execution {} already {}, ignoring completion", executionId, execution.getStatus());
            return execution;
        }

        applyProgress(execution, summary);
        var completedAt = Instant.now();
        execution.setStatus(ExecutionStatus.COMPLETED);
        execution.setCompletedAt(completedAt);
        execution.setProcessingDurationMs(Duration.between(execution.getStartedAt(), completedAt).toMillis());

        execution = executionRepository.save(execution);
        log.info("Execution {} of schedule {} completed: {} processed, {} failed in {}ms",
                executionId, execution.getScheduleId(), execution.getProcessedEmails(), execution.getFailedEmails(),
                execution.getProcessingDurationMs());
        return execution;
    }

    @Transactional
    public ScheduleExecution failExecution(UUID executionId, Throwable error) {
        var execution = getExecution(executionId);
        if (execution.getStatus().isTerminal()) {
            log.warn("Execution {} already {}, ignoring failure: {}", executionId, execution.getStatus(), error.getMessage());
            return execution;
        }

        var completedAt = Instant.now();
        execution.setStatus(ExecutionStatus.FAILED);
        execution.setCompletedAt(completedAt);
        execution.setProcessingDurationMs(Duration.between(execution.getStartedAt(), completedAt).toMillis());
        execution.setErrorMessage(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        execution.setErrorDetails(buildErrorDetails(error, completedAt));

        execution = executionRepository.save(execution);
        log.error("Execution {} of schedule {} failed (attempt {} of {}): {}",
                executionId, execution.getScheduleId(), execution.getAttemptNumber(), execution.getMaxAttempts(),
                execution.getErrorMessage());
        return execution;
    }

    @Transactional(readOnly = true)
    public Optional<ScheduleExecution> findLatest(UUID scheduleId) {
        return executionRepository.findFirstByScheduleIdOrderByStartedAtDesc(scheduleId);
    }

    @Transactional(readOnly = true)
    public Optional<ScheduleExecution> findLastSuccessful(UUID scheduleId) {
        return executionRepository.findFirstByScheduleIdAndStatusOrderByCompletedAtDesc(scheduleId, ExecutionStatus.COMPLETED);
    }

    /**
     * Failed runs already recorded for one due instant of a schedule.
     */
    @Transactional(readOnly = true)
    public long countFailedAttempts(UUID scheduleId, Instant scheduledFor) {
        if (scheduledFor == null) {
            return 0L;
        }
        return executionRepository.countByScheduleIdAndScheduledForAndStatus(scheduleId, scheduledFor, ExecutionStatus.FAILED);
    }

    @Transactional(readOnly = true)
    public boolean isRunning(UUID scheduleId) {
        return executionRepository.existsByScheduleIdAndStatus(scheduleId, ExecutionStatus.RUNNING);
    }

    private ScheduleExecution getExecution(UUID executionId) {
        return executionRepository.findById(executionId)
                .orElseThrow(() -> new IllegalArgumentException("Execution not found: " + executionId));
    }

    private static void applyProgress(ScheduleExecution execution, ExecutionProgress progress) {
        if (progress == null) {
            return;
        }
        if (progress.getTotalBatches() != null) {
            execution.setTotalBatches(progress.getTotalBatches());
        }
        if (progress.getCompletedBatches() != null) {
            execution.setCompletedBatches(progress.getCompletedBatches());
        }
        if (progress.getTotalEmails() != null) {
            execution.setTotalEmails(progress.getTotalEmails());
        }
        if (progress.getProcessedEmails() != null) {
            execution.setProcessedEmails(progress.getProcessedEmails());
        }
        if (progress.getFailedEmails() != null) {
            execution.setFailedEmails(progress.getFailedEmails());
        }
    }

    private static Map<String, Object> buildErrorDetails(Throwable error, Instant failedAt) {
        var details = new HashMap<String, Object>();
        details.put("errorType", error.getClass().getName());
        details.put("stackTrace", truncateStackTrace(error));
        details.put("timestamp", failedAt.toString());
        if (error.getCause() != null) {
            details.put("cause", error.getCause().getClass().getName() + ": " + error.getCause().getMessage());
        }
        return details;
    }

    private static String truncateStackTrace(Throwable error) {
        var writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        var trace = writer.toString();
        if (trace.length() <= MAX_STACK_TRACE_LENGTH) {
            return trace;
        }
        return trace.substring(0, MAX_STACK_TRACE_LENGTH) + "\n... (truncated)";
    }
}
