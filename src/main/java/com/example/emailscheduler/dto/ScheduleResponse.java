package com.example.emailscheduler.dto;

import com.example.emailscheduler.domain.enums.LlmFocus;
import com.example.emailscheduler.domain.enums.ScheduleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for schedule data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private UUID id;
    private String ownerId;
    private String accountId;
    private String name;
    private String description;
    private ScheduleType type;
    private Instant dateRangeFrom;
    private Instant dateRangeTo;
    private String cronExpression;
    private String timezone;
    private List<Instant> specificDates;
    private boolean enabled;
    private boolean defaultSchedule;
    private Integer batchSize;
    private Map<String, String> categoryPriorities;
    private Map<String, String> senderPriorities;
    private LlmFocus llmFocus;
    private Instant nextExecutionAt;
    private Instant lastExecutedAt;
    private Integer totalExecutions;
    private Integer successfulExecutions;
    private Integer failedExecutions;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Recent runs, populated on detail requests
     */
    private List<ExecutionResponse> recentExecutions;

    /**
     * Non-blocking validation findings, populated on create and update
     */
    private List<String> warnings;
}
