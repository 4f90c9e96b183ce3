package com.example.emailscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Priority override applied to an email category or sender.
 */
@Getter
@RequiredArgsConstructor
public enum Priority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    URGENT(4);

    private final int value;

    /**
     * Parse a priority name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Priority fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Priority must not be null");
        }
        return valueOf(name.trim().toUpperCase());
    }

    public static boolean isValid(String name) {
        try {
            fromName(name);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
