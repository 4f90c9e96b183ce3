package com.example.emailscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Result of a bulk operation.
 * Includes both updated schedules and per-item errors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkOperationResult {

    @Builder.Default
    private List<UUID> updated = new ArrayList<>();

    @Builder.Default
    private List<ItemError> errors = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemError {
        private UUID scheduleId;
        private String error;
    }
}
