package com.example.emailscheduler.dto;

import com.example.emailscheduler.domain.enums.LlmFocus;
import com.example.emailscheduler.domain.enums.ScheduleType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating a schedule.
 * <p>
 * Type-specific fields are checked by the schedule validator, not by bean
 * validation, so that all problems are reported together.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduleRequest {

    @NotBlank(message = "Owner ID is required")
    private String ownerId;

    @NotBlank(message = "Account ID is required")
    private String accountId;

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    private String description;

    @NotNull(message = "Schedule type is required")
    private ScheduleType type;

    /**
     * DATE_RANGE only
     */
    private Instant dateRangeFrom;

    private Instant dateRangeTo;

    /**
     * RECURRING only, five-field cron (minute hour day-of-month month day-of-week)
     */
    private String cronExpression;

    /**
     * IANA zone id; UTC when omitted
     */
    private String timezone;

    /**
     * SPECIFIC_DATES only
     */
    private List<Instant> specificDates;

    @Builder.Default
    private Boolean enabled = true;

    @Min(value = 1, message = "Batch size must be at least 1")
    @Max(value = 100, message = "Batch size must be at most 100")
    private Integer batchSize;

    private Map<String, String> categoryPriorities;

    private Map<String, String> senderPriorities;

    private LlmFocus llmFocus;
}
