package com.example.emailscheduler.dto;

import com.example.emailscheduler.domain.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Latest execution of a schedule, grouped for progress display.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStatusResponse {

    private UUID scheduleId;
    private UUID executionId;
    private ExecutionStatus status;
    private Progress progress;
    private Timing timing;
    private Failure error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Progress {
        private int totalBatches;
        private int completedBatches;
        private int totalEmails;
        private int processedEmails;
        private int failedEmails;
        private int percent;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Timing {
        private Instant scheduledFor;
        private Instant startedAt;
        private Instant completedAt;
        private Long durationMs;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Failure {
        private String message;
        private Map<String, Object> details;
    }
}
