package com.example.emailscheduler.service.executor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of running every schedule due at one instant.
 */
@Value
@Builder
public class GroupExecutionResult {

    Instant executionTime;
    boolean lockAcquired;
    List<MemberOutcome> members;

    public static GroupExecutionResult skipped(Instant executionTime) {
        return GroupExecutionResult.builder()
                .executionTime(executionTime)
                .lockAcquired(false)
                .members(List.of())
                .build();
    }

    public long countByStatus(MemberStatus status) {
        return members.stream().filter(member -> member.getStatus() == status).count();
    }

    public enum MemberStatus {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    @Value
    @Builder
    public static class MemberOutcome {
        UUID scheduleId;
        MemberStatus status;
        UUID executionId;
        String error;
    }
}
