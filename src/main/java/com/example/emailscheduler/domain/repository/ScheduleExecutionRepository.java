package com.example.emailscheduler.domain.repository;

import com.example.emailscheduler.domain.entity.ScheduleExecution;
import com.example.emailscheduler.domain.enums.ExecutionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ScheduleExecution entity.
 */
@Repository
public interface ScheduleExecutionRepository extends JpaRepository<ScheduleExecution, UUID> {

    Optional<ScheduleExecution> findFirstByScheduleIdOrderByStartedAtDesc(UUID scheduleId);

    /**
     * Most recent successful run, used as the start of a recurring email window
     */
    Optional<ScheduleExecution> findFirstByScheduleIdAndStatusOrderByCompletedAtDesc(UUID scheduleId, ExecutionStatus status);

    List<ScheduleExecution> findByScheduleIdOrderByStartedAtDesc(UUID scheduleId, Pageable pageable);

    List<ScheduleExecution> findByScheduleIdInOrderByStartedAtDesc(Collection<UUID> scheduleIds, Pageable pageable);

    long countByScheduleIdAndScheduledForAndStatus(UUID scheduleId, Instant scheduledFor, ExecutionStatus status);

    boolean existsByScheduleIdAndStatus(UUID scheduleId, ExecutionStatus status);

    long countByStatus(ExecutionStatus status);

    long countByScheduleIdIn(Collection<UUID> scheduleIds);

    long countByScheduleIdInAndStatus(Collection<UUID> scheduleIds, ExecutionStatus status);

    @Query("""
            SELECT AVG(e.processingDurationMs) FROM ScheduleExecution e
            WHERE e.scheduleId IN :scheduleIds
              AND e.status = com.example.emailscheduler.domain.enums.ExecutionStatus.COMPLETED
            """)
    Double averageProcessingDurationMs(@Param("scheduleIds") Collection<UUID> scheduleIds);

    @Query("""
            SELECT COALESCE(SUM(e.processedEmails), 0) FROM ScheduleExecution e
            WHERE e.scheduleId IN :scheduleIds
              AND e.status = com.example.emailscheduler.domain.enums.ExecutionStatus.COMPLETED
              AND e.completedAt >= :since
            """)
    long sumProcessedEmailsSince(@Param("scheduleIds") Collection<UUID> scheduleIds, @Param("since") Instant since);

    @Modifying
    @Query("DELETE FROM ScheduleExecution e WHERE e.scheduleId = :scheduleId")
    int deleteByScheduleId(@Param("scheduleId") UUID scheduleId);
}
