package com.example.emailscheduler.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Request for bulk enable/disable
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkScheduleRequest {

    @NotEmpty(message = "Schedule IDs are required")
    @Size(max = 100, message = "Maximum 100 schedules per request")
    private List<UUID> scheduleIds;

    @NotNull(message = "Enabled flag is required")
    private Boolean enabled;
}
