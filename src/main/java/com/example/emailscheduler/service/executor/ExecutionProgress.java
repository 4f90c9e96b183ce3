package com.example.emailscheduler.service.executor;

import lombok.Builder;
import lombok.Value;

/**
 * Absolute progress counters of an execution. Null fields are left unchanged.
 */
@Value
@Builder
public class ExecutionProgress {
    Integer totalBatches;
    Integer completedBatches;
    Integer totalEmails;
    Integer processedEmails;
    Integer failedEmails;
}
