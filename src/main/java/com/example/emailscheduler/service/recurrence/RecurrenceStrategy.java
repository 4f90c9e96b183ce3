package com.example.emailscheduler.service.recurrence;

import com.example.emailscheduler.exception.RecurrenceParseException;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Evaluates a recurrence expression in a timezone.
 * <p>
 * Implementations must be pure: the same arguments always produce the same result.
 */
public interface RecurrenceStrategy {

    /**
     * First occurrence strictly after {@code after}.
     *
     * @return the occurrence, or empty if the expression never fires again
     * @throws RecurrenceParseException if the expression cannot be parsed
     */
    Optional<Instant> nextOccurrence(String expression, ZoneId zone, Instant after);

    /**
     * @throws RecurrenceParseException if the expression cannot be parsed
     */
    void validate(String expression);
}
