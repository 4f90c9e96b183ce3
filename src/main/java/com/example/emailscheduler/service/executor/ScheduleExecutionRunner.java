package com.example.emailscheduler.service.executor;

import com.example.emailscheduler.client.ClientModels.EmailMessage;
import com.example.emailscheduler.client.ClientModels.ProcessingRequest;
import com.example.emailscheduler.client.EmailProcessingPipeline;
import com.example.emailscheduler.client.MailFetchClient;
import com.example.emailscheduler.client.MailSessionPool;
import com.example.emailscheduler.config.EmailSchedulerProperties;
import com.example.emailscheduler.config.MetricsConfig;
import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.entity.ScheduleExecution;
import com.example.emailscheduler.exception.ScheduleExecutionException;
import com.example.emailscheduler.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs one schedule for one due instant.
 * <p>
 * Steps:
 * 1. Create a RUNNING execution
 * 2. Work out the email window for the schedule type
 * 3. Fetch emails through a leased mail session
 * 4. Hand them to the processing pipeline in batches, recording progress per batch
 * 5. Complete the execution and advance the schedule
 * <p>
 * Any failure marks the execution FAILED and is rethrown as
 * {@link ScheduleExecutionException}. No timeout applies: a hung collaborator
 * call blocks this execution until it returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleExecutionRunner {

    private static final Duration SPECIFIC_DATE_WINDOW = Duration.ofHours(24);

    private final ExecutionTracker executionTracker;
    private final ScheduleAdvancer scheduleAdvancer;
    private final MailSessionPool mailSessionPool;
    private final MailFetchClient mailFetchClient;
    private final EmailProcessingPipeline processingPipeline;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final EmailSchedulerProperties properties;

    public ScheduleExecution execute(ProcessingSchedule schedule, Instant dueAt) {
        var scheduleId = schedule.getId();
        log.info("Starting execution of schedule {} ({}, account {}) due at {}",
                scheduleId, schedule.getType(), schedule.getAccountId(), dueAt);

        var timerSample = metricsConfig.startExecutionTimer();
        var execution = executionTracker.createExecution(scheduleId, dueAt, properties.getMaxAttempts());

        ScheduleExecution completed;
        try {
            var window = resolveWindow(schedule, dueAt, Instant.now());
            var emails = fetchEmails(schedule, window);
            completed = processEmails(schedule, execution, emails);
        } catch (Exception e) {
            handleFailure(schedule, execution, e);
            metricsConfig.recordExecution(timerSample, schedule.getType(), false);
            metricsConfig.recordExecutionFailure(schedule.getType(), e.getClass().getSimpleName());
            throw new ScheduleExecutionException(scheduleId, execution.getId(), e);
        }

        scheduleAdvancer.recordSuccess(scheduleId, Instant.now());
        metricsConfig.recordExecution(timerSample, schedule.getType(), true);
        return completed;
    }

    /**
     * Email window of a run:
     * DATE_RANGE uses its configured range, RECURRING covers everything since the
     * last successful run (or since creation), SPECIFIC_DATES covers the 24 hours
     * starting at the due instant.
     */
    EmailWindow resolveWindow(ProcessingSchedule schedule, Instant dueAt, Instant now) {
        return switch (schedule.getType()) {
            case DATE_RANGE -> new EmailWindow(schedule.getDateRangeFrom(), schedule.getDateRangeTo());
            case RECURRING -> {
                var since = executionTracker.findLastSuccessful(schedule.getId())
                        .map(ScheduleExecution::getCompletedAt)
                        .orElse(schedule.getCreatedAt());
                yield new EmailWindow(since, now);
            }
            case SPECIFIC_DATES -> new EmailWindow(dueAt, dueAt.plus(SPECIFIC_DATE_WINDOW));
        };
    }

    private List<EmailMessage> fetchEmails(ProcessingSchedule schedule, EmailWindow window) {
        try (var lease = mailSessionPool.lease(schedule.getAccountId())) {
            try {
                return mailFetchClient.fetchEmailsInRange(lease.getSession(), window.getSince(), window.getBefore(),
                        properties.getMaxEmailsPerExecution());
            } catch (RuntimeException e) {
                lease.invalidate();
                throw e;
            }
        }
    }

    private ScheduleExecution processEmails(ProcessingSchedule schedule, ScheduleExecution execution, List<EmailMessage> emails) {
        var batchSize = schedule.getBatchSize() != null && schedule.getBatchSize() > 0
                ? schedule.getBatchSize()
                : properties.getDefaultBatchSize();
        var totalBatches = (emails.size() + batchSize - 1) / batchSize;

        executionTracker.updateProgress(execution.getId(), ExecutionProgress.builder()
                .totalEmails(emails.size())
                .totalBatches(totalBatches)
                .completedBatches(0)
                .build());

        var processed = 0;
        var failed = 0;
        for (int batch = 0; batch < totalBatches; batch++) {
            var chunk = emails.subList(batch * batchSize, Math.min(emails.size(), (batch + 1) * batchSize));
            var outcome = processingPipeline.processEmails(ProcessingRequest.builder()
                    .scheduleId(schedule.getId())
                    .executionId(execution.getId())
                    .accountId(schedule.getAccountId())
                    .batchSize(batchSize)
                    .categoryPriorities(schedule.getCategoryPriorities())
                    .senderPriorities(schedule.getSenderPriorities())
                    .llmFocus(schedule.getLlmFocus())
                    .emails(List.copyOf(chunk))
                    .build());

            processed += outcome.getProcessed();
            failed += outcome.getFailed();
            executionTracker.updateProgress(execution.getId(), ExecutionProgress.builder()
                    .completedBatches(batch + 1)
                    .processedEmails(processed)
                    .failedEmails(failed)
                    .build());
        }

        return executionTracker.completeExecution(execution.getId(), ExecutionProgress.builder()
                .totalEmails(emails.size())
                .totalBatches(totalBatches)
                .completedBatches(totalBatches)
                .processedEmails(processed)
                .failedEmails(failed)
                .build());
    }

    private void handleFailure(ProcessingSchedule schedule, ScheduleExecution execution, Exception error) {
        var failed = executionTracker.failExecution(execution.getId(), error);
        scheduleAdvancer.recordFailure(schedule.getId(), failed.getAttemptNumber(), failed.getMaxAttempts(), Instant.now());

        if (failed.getAttemptNumber() >= failed.getMaxAttempts()) {
            slackAlertService.sendExecutionFailedAlert(schedule, failed);
        }
    }

    /**
     * Half-open interval {@code [since, before)} of email receipt times.
     */
    @Value
    static class EmailWindow {
        Instant since;
        Instant before;
    }
}
