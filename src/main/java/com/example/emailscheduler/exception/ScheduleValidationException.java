package com.example.emailscheduler.exception;

import com.example.emailscheduler.dto.ValidationResult;
import lombok.Getter;

/**
 * Exception for a schedule configuration that failed validation.
 * Nothing is persisted when this is thrown.
 */
@Getter
public class ScheduleValidationException extends RuntimeException {

    private final transient ValidationResult result;

    public ScheduleValidationException(ValidationResult result) {
        super("Schedule validation failed: " + String.join("; ", result.getErrors()));
        this.result = result;
    }

    public ScheduleValidationException(String message) {
        super(message);
        this.result = ValidationResult.invalid(message);
    }
}
