package com.example.emailscheduler.dto;

import com.example.emailscheduler.domain.enums.ScheduleType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Candidate timing to check against an account's existing schedules
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictCheckRequest {

    @NotBlank(message = "Owner ID is required")
    private String ownerId;

    @NotBlank(message = "Account ID is required")
    private String accountId;

    @NotNull(message = "Schedule type is required")
    private ScheduleType type;

    private Instant dateRangeFrom;

    private Instant dateRangeTo;

    private String cronExpression;

    private String timezone;

    private List<Instant> specificDates;

    /**
     * Schedule being edited, left out of the comparison
     */
    private UUID excludeScheduleId;
}
