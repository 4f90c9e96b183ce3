package com.example.emailscheduler.domain.entity;

import com.example.emailscheduler.domain.enums.LlmFocus;
import com.example.emailscheduler.domain.enums.ScheduleType;
import com.example.emailscheduler.domain.model.ScheduleDefinition;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted definition of when and how an account's emails are processed.
 * <p>
 * Supports:
 * - One-shot date ranges, cron recurrences and explicit date lists
 * - Per-category and per-sender priority overrides
 * - Cumulative execution counters
 * - Optimistic locking through the version column
 */
@Entity
@Table(name = "processing_schedules",
        uniqueConstraints = @UniqueConstraint(name = "uk_schedule_owner_name", columnNames = {"owner_id", "name"}),
        indexes = {
                @Index(name = "idx_schedule_due", columnList = "is_enabled, next_execution_at"),
                @Index(name = "idx_schedule_owner_account", columnList = "owner_id, account_id"),
                @Index(name = "idx_schedule_type", columnList = "schedule_type")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessingSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    /**
     * Mail account whose inbox this schedule processes
     */
    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false, length = 30)
    private ScheduleType type;

    @Column(name = "date_range_from")
    private Instant dateRangeFrom;

    @Column(name = "date_range_to")
    private Instant dateRangeTo;

    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Column(name = "timezone", length = 50)
    @Builder.Default
    private String timezone = "UTC";

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "schedule_specific_dates", joinColumns = @JoinColumn(name = "schedule_id"))
    @Column(name = "run_at", nullable = false)
    @OrderColumn(name = "position")
    @Builder.Default
    private List<Instant> specificDates = new ArrayList<>();

    @Column(name = "is_enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    /**
     * Marks the initial schedule created for a new account
     */
    @Column(name = "is_default", nullable = false)
    @Builder.Default
    private boolean defaultSchedule = false;

    @Column(name = "batch_size", nullable = false)
    @Builder.Default
    private Integer batchSize = 5;

    /**
     * Category name to priority name, e.g. {"INVOICE": "HIGH"}
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "category_priorities", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, String> categoryPriorities = new HashMap<>();

    /**
     * Sender address to priority name
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "sender_priorities", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, String> senderPriorities = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "llm_focus", length = 20)
    @Builder.Default
    private LlmFocus llmFocus = LlmFocus.GENERAL;

    /**
     * Next due instant; null when the schedule has nothing left to run
     */
    @Column(name = "next_execution_at")
    private Instant nextExecutionAt;

    @Column(name = "last_executed_at")
    private Instant lastExecutedAt;

    @Column(name = "total_executions", nullable = false)
    @Builder.Default
    private Integer totalExecutions = 0;

    @Column(name = "successful_executions", nullable = false)
    @Builder.Default
    private Integer successfulExecutions = 0;

    @Column(name = "failed_executions", nullable = false)
    @Builder.Default
    private Integer failedExecutions = 0;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Whether the poller should pick this schedule up at the given instant.
     */
    public boolean isDueAt(Instant now) {
        return enabled && nextExecutionAt != null && !nextExecutionAt.isAfter(now);
    }

    public void recordSuccess(Instant executedAt) {
        this.lastExecutedAt = executedAt;
        this.totalExecutions = totalExecutions + 1;
        this.successfulExecutions = successfulExecutions + 1;
    }

    public void recordFailure() {
        this.totalExecutions = totalExecutions + 1;
        this.failedExecutions = failedExecutions + 1;
    }

    public ScheduleDefinition toDefinition() {
        return ScheduleDefinition.builder()
                .ownerId(ownerId)
                .accountId(accountId)
                .type(type)
                .dateRangeFrom(dateRangeFrom)
                .dateRangeTo(dateRangeTo)
                .cronExpression(cronExpression)
                .timezone(timezone)
                .specificDates(specificDates != null ? specificDates : List.of())
                .batchSize(batchSize)
                .categoryPriorities(categoryPriorities != null ? categoryPriorities : Map.of())
                .senderPriorities(senderPriorities != null ? senderPriorities : Map.of())
                .enabled(enabled)
                .build();
    }
}
