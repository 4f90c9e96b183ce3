package com.example.emailscheduler.domain.repository;

import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.enums.ScheduleType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ProcessingSchedule entity.
 */
@Repository
public interface ProcessingScheduleRepository extends JpaRepository<ProcessingSchedule, UUID> {

    /**
     * Enabled schedules whose next execution is at or before the given instant,
     * oldest due first.
     */
    @Query("""
            SELECT s FROM ProcessingSchedule s
            WHERE s.enabled = true
              AND s.nextExecutionAt IS NOT NULL
              AND s.nextExecutionAt <= :now
            ORDER BY s.nextExecutionAt ASC
            """)
    List<ProcessingSchedule> findDueSchedules(@Param("now") Instant now);

    @Query("""
            SELECT COUNT(s) FROM ProcessingSchedule s
            WHERE s.enabled = true
              AND s.nextExecutionAt IS NOT NULL
              AND s.nextExecutionAt <= :now
            """)
    long countDueSchedules(@Param("now") Instant now);

    /**
     * Candidates for timing conflicts: same owner, account and type.
     */
    List<ProcessingSchedule> findByOwnerIdAndAccountIdAndType(String ownerId, String accountId, ScheduleType type);

    /**
     * Enabled recurring schedules with an expression, for the calendar view
     */
    @Query("""
            SELECT s FROM ProcessingSchedule s
            WHERE s.enabled = true
              AND s.type = com.example.emailscheduler.domain.enums.ScheduleType.RECURRING
              AND s.cronExpression IS NOT NULL
            ORDER BY s.createdAt ASC
            """)
    List<ProcessingSchedule> findEnabledRecurringSchedules();

    List<ProcessingSchedule> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    List<ProcessingSchedule> findByAccountIdOrderByCreatedAtDesc(String accountId);

    Optional<ProcessingSchedule> findFirstByOwnerIdAndAccountIdAndDefaultScheduleTrue(String ownerId, String accountId);

    boolean existsByOwnerIdAndName(String ownerId, String name);

    boolean existsByOwnerIdAndNameAndIdNot(String ownerId, String name, UUID id);

    long countByEnabledTrue();

    long countByOwnerId(String ownerId);

    long countByOwnerIdAndEnabledTrue(String ownerId);
}
