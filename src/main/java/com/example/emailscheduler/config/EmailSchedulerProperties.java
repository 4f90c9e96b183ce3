package com.example.emailscheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the email scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "email-scheduler")
public class EmailSchedulerProperties {

    /**
     * Polling interval in milliseconds for discovering due schedules
     */
    @Min(1000)
    private long pollIntervalMs = 60000;

    /**
     * Number of threads running group members concurrently
     */
    @Min(1)
    private int executorPoolSize = 8;

    /**
     * Upper bound of emails fetched for a single execution
     */
    @Min(1)
    private int maxEmailsPerExecution = 50;

    /**
     * Batch size used when a schedule does not set one
     */
    @Min(1)
    private int defaultBatchSize = 5;

    /**
     * Attempts allowed for one due instant before the schedule moves on
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * Occurrences listed per schedule in the calendar view
     */
    @Min(1)
    private int calendarOccurrences = 10;

    /**
     * How far back the initial schedule of a new account reaches
     */
    @Min(1)
    private int initialLookbackDays = 30;

    /**
     * Age in minutes after which a held execution lock is reported as stale
     */
    @Min(1)
    private int staleLockThresholdMinutes = 120;

    /**
     * Delete stale execution locks instead of only reporting them
     */
    private boolean staleLockReclaimEnabled = false;

    @Min(1000)
    private long staleLockCheckIntervalMs = 300000;

    @Min(1000)
    private long metricsUpdateIntervalMs = 60000;

    @Valid
    private MailSessionPool mailSessionPool = new MailSessionPool();

    @Data
    public static class MailSessionPool {

        /**
         * Sessions kept open per account
         */
        @Min(1)
        private int maxPerAccount = 2;

        /**
         * Idle minutes before a pooled session is closed
         */
        @Min(1)
        private int maxIdleMinutes = 10;

        @Min(1000)
        private long evictionIntervalMs = 60000;
    }
}
