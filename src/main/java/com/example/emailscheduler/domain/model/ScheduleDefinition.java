package com.example.emailscheduler.domain.model;

import com.example.emailscheduler.domain.enums.ScheduleType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Timing and ownership fields of a schedule, independent of persistence.
 * <p>
 * Used for validation and next-run calculation of both stored schedules and
 * candidate configurations that have not been saved yet.
 */
@Value
@Builder(toBuilder = true)
public class ScheduleDefinition {

    String ownerId;
    String accountId;
    ScheduleType type;

    Instant dateRangeFrom;
    Instant dateRangeTo;

    String cronExpression;
    String timezone;

    @Singular
    List<Instant> specificDates;

    Integer batchSize;

    @Singular
    Map<String, String> categoryPriorities;

    @Singular
    Map<String, String> senderPriorities;

    @Builder.Default
    boolean enabled = true;
}
