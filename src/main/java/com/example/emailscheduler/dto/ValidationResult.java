package com.example.emailscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating a schedule configuration.
 * <p>
 * Errors and conflicts block persistence; warnings are informational.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    private boolean valid;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Builder.Default
    private List<ScheduleConflict> conflicts = new ArrayList<>();

    public static ValidationResult invalid(String error) {
        return ValidationResult.builder().valid(false).errors(new ArrayList<>(List.of(error))).build();
    }

    public boolean hasConflicts() {
        return conflicts != null && !conflicts.isEmpty();
    }
}
