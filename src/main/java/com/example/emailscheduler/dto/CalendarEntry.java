package com.example.emailscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Upcoming occurrences of one recurring schedule.
 * An expression that cannot be evaluated yields an error instead of occurrences.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEntry {

    private UUID scheduleId;
    private String scheduleName;
    private String ownerId;
    private String accountId;
    private String cronExpression;
    private String timezone;
    private List<Instant> occurrences;
    private String error;
}
