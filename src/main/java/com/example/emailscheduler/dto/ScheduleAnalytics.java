package com.example.emailscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Per-owner execution statistics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleAnalytics {

    private String ownerId;
    private long totalSchedules;
    private long activeSchedules;
    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;
    private double successRate;
    private long averageProcessingTimeMs;
    private long emailsProcessedToday;
    private long emailsProcessedThisWeek;
    private long emailsProcessedThisMonth;
    private List<ExecutionResponse> recentExecutions;
    private Instant generatedAt;
}
