package com.example.emailscheduler.dto;

import com.example.emailscheduler.domain.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResponse {

    private UUID id;
    private UUID scheduleId;
    private ExecutionStatus status;
    private Instant scheduledFor;
    private Instant startedAt;
    private Instant completedAt;
    private Integer totalBatches;
    private Integer completedBatches;
    private Integer totalEmails;
    private Integer processedEmails;
    private Integer failedEmails;
    private Integer progressPercent;
    private Integer attemptNumber;
    private Integer maxAttempts;
    private String errorMessage;
    private Map<String, Object> errorDetails;
    private Long processingDurationMs;
    private String executorInstance;
}
