package com.example.emailscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a schedule decides its due instants.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleType {

    /**
     * One-shot run over a fixed email window; due immediately, disabled after it runs.
     */
    DATE_RANGE("Date Range", true),

    /**
     * Repeats according to a cron expression evaluated in the schedule's timezone.
     */
    RECURRING("Recurring", false),

    /**
     * Runs once at each configured instant; dormant when none remain.
     */
    SPECIFIC_DATES("Specific Dates", false);

    private final String displayName;

    /**
     * Whether the schedule is disabled after one successful execution
     */
    private final boolean oneShot;
}
