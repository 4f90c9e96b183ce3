package com.example.emailscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of one schedule execution.
 * An execution starts RUNNING and moves exactly once to a terminal status.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStatus {

    RUNNING("running", "Running"),

    COMPLETED("completed", "Completed"),

    FAILED("failed", "Failed"),

    /**
     * Set by operators only; the scheduler never cancels a run on its own.
     */
    CANCELLED("cancelled", "Cancelled");

    private final String code;
    private final String displayName;

    public static ExecutionStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status code: " + code);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
