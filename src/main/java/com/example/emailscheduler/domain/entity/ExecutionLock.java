package com.example.emailscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Exclusive claim on one due instant.
 * <p>
 * The unique constraint on execution_time is the only coordination between
 * scheduler instances: the instance whose insert succeeds runs the group.
 */
@Entity
@Table(name = "execution_locks",
        uniqueConstraints = @UniqueConstraint(name = "uk_execution_lock_time", columnNames = "execution_time"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionLock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "execution_time", nullable = false)
    private Instant executionTime;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "schedule_ids", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> scheduleIds = new ArrayList<>();

    @Column(name = "is_locked", nullable = false)
    @Builder.Default
    private boolean locked = true;

    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
