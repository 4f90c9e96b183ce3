package com.example.emailscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for schedule not found
 */
@Getter
public class ScheduleNotFoundException extends RuntimeException {

    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public ScheduleNotFoundException(UUID scheduleId) {
        this(scheduleId.toString());
    }
}
