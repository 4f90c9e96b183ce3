package com.example.emailscheduler.domain.entity;

import com.example.emailscheduler.domain.enums.ExecutionStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One concrete run of a schedule.
 * Each run owns its record; it is created RUNNING and finished exactly once.
 */
@Entity
@Table(name = "schedule_executions", indexes = {
        @Index(name = "idx_execution_schedule_started", columnList = "schedule_id, started_at"),
        @Index(name = "idx_execution_schedule_due", columnList = "schedule_id, scheduled_for"),
        @Index(name = "idx_execution_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "schedule_id", nullable = false)
    private UUID scheduleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ExecutionStatus status;

    /**
     * Due instant this run serves
     */
    @Column(name = "scheduled_for")
    private Instant scheduledFor;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "total_batches", nullable = false)
    @Builder.Default
    private Integer totalBatches = 0;

    @Column(name = "completed_batches", nullable = false)
    @Builder.Default
    private Integer completedBatches = 0;

    @Column(name = "total_emails", nullable = false)
    @Builder.Default
    private Integer totalEmails = 0;

    @Column(name = "processed_emails", nullable = false)
    @Builder.Default
    private Integer processedEmails = 0;

    @Column(name = "failed_emails", nullable = false)
    @Builder.Default
    private Integer failedEmails = 0;

    @Column(name = "attempt_number", nullable = false)
    @Builder.Default
    private Integer attemptNumber = 1;

    @Column(name = "max_attempts", nullable = false)
    @Builder.Default
    private Integer maxAttempts = 3;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Error type, truncated stack trace and failure timestamp
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_details", columnDefinition = "jsonb")
    private Map<String, Object> errorDetails;

    @Column(name = "processing_duration_ms")
    private Long processingDurationMs;

    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }

    /**
     * Percentage of batches done, 0 when the batch count is not known yet
     */
    public int getProgressPercent() {
        if (totalBatches == null || totalBatches == 0) {
            return status == ExecutionStatus.COMPLETED ? 100 : 0;
        }
        return (int) Math.round(completedBatches * 100.0 / totalBatches);
    }

    public boolean isSuccessful() {
        return status == ExecutionStatus.COMPLETED;
    }
}
