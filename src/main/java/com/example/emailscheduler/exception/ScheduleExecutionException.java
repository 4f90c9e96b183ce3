package com.example.emailscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a failed schedule execution.
 * Raised after the execution record has been marked FAILED.
 */
@Getter
public class ScheduleExecutionException extends RuntimeException {

    private final UUID scheduleId;
    private final UUID executionId;

    public ScheduleExecutionException(UUID scheduleId, UUID executionId, Exception cause) {
        super(String.format("Schedule %s execution %s failed: %s", scheduleId, executionId, cause.getMessage()), cause);
        this.scheduleId = scheduleId;
        this.executionId = executionId;
    }
}
