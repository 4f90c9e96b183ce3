package com.example.emailscheduler.exception;

import com.example.emailscheduler.dto.ValidationResult;
import lombok.Getter;

/**
 * Exception for a schedule whose timing collides with an existing schedule
 */
@Getter
public class ScheduleConflictException extends RuntimeException {

    private final transient ValidationResult result;

    public ScheduleConflictException(ValidationResult result) {
        super(String.format("Schedule conflicts with %d existing timing(s)", result.getConflicts().size()));
        this.result = result;
    }
}
