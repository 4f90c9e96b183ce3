package com.example.emailscheduler.exception;

import lombok.Getter;

/**
 * Exception for a recurrence expression or timezone that cannot be evaluated
 */
@Getter
public class RecurrenceParseException extends RuntimeException {

    private final String expression;

    public RecurrenceParseException(String expression, String message) {
        super(String.format("Invalid recurrence '%s': %s", expression, message));
        this.expression = expression;
    }

    public RecurrenceParseException(String expression, Exception cause) {
        super(String.format("Invalid recurrence '%s': %s", expression, cause.getMessage()), cause);
        this.expression = expression;
    }
}
