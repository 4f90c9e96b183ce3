package com.example.emailscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A timing collision with one or more existing schedules.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleConflict {

    /**
     * Colliding instant; null for recurrence-level conflicts
     */
    private Instant conflictTime;

    private String reason;

    private List<UUID> conflictingScheduleIds;

    private List<String> conflictingScheduleNames;

    private List<Instant> suggestedAlternatives;
}
