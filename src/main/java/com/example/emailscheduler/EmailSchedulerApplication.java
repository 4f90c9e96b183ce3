package com.example.emailscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Email Schedule Service Application
 * <p>
 * Decides when each account's fetch-and-classify email job runs and records
 * the outcome of every run.
 * <p>
 * Features:
 * - One-shot date ranges, cron recurrences with timezones and explicit date lists
 * - Conflict detection between schedules of the same account
 * - Per-instant execution locks so a due group runs once across all instances
 * - Parallel group execution with per-schedule failure isolation
 * - Slack alerting for failed runs and stuck locks
 */
@EnableScheduling
@SpringBootApplication
public class EmailSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailSchedulerApplication.class, args);
    }
}
