package com.example.emailscheduler.domain.repository;

import com.example.emailscheduler.domain.entity.ExecutionLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ExecutionLock entity.
 */
@Repository
public interface ExecutionLockRepository extends JpaRepository<ExecutionLock, UUID> {

    Optional<ExecutionLock> findByExecutionTime(Instant executionTime);

    /**
     * Remove the claim on a due instant.
     *
     * @return number of rows deleted (0 if the lock was already gone)
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM ExecutionLock l WHERE l.executionTime = :executionTime")
    int deleteByExecutionTime(@Param("executionTime") Instant executionTime);

    List<ExecutionLock> findByCreatedAtBefore(Instant threshold);
}
