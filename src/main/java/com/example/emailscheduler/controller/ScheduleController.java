package com.example.emailscheduler.controller;

import com.example.emailscheduler.dto.*;
import com.example.emailscheduler.service.ScheduleManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for email processing schedules.
 * <p>
 * Provides endpoints for:
 * - Creating, updating and deleting schedules
 * - Validating configurations and checking timing conflicts
 * - Manual execution and execution status
 * - Calendar, bulk enable/disable and analytics
 */
@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
@Tag(name = "Schedule Management", description = "APIs for managing email processing schedules")
public class ScheduleController {

    private final ScheduleManagementService scheduleManagementService;

    // === Schedule Creation ===

    @PostMapping
    @Operation(summary = "Create a schedule", description = "Validate and create a new processing schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> createSchedule(@Valid @RequestBody CreateScheduleRequest request) {
        log.info("API: Create {} schedule '{}' for account {}", request.getType(), request.getName(), request.getAccountId());

        var response = scheduleManagementService.createSchedule(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Schedule created successfully"));
    }

    @PostMapping("/default")
    @Operation(summary = "Create the initial schedule of an account",
            description = "Create the disabled look-back schedule of a newly connected account, or return the existing one")
    public ResponseEntity<ApiResponse<ScheduleResponse>> createDefaultSchedule(
            @Parameter(description = "Owner ID") @RequestParam String ownerId,
            @Parameter(description = "Mail account ID") @RequestParam String accountId) {
        log.info("API: Create default schedule for account {}", accountId);

        var response = scheduleManagementService.createDefaultSchedule(ownerId, accountId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    // === Schedule Retrieval ===

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get schedule by ID", description = "Retrieve a schedule with its recent executions")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getSchedule(scheduleId)));
    }

    @GetMapping
    @Operation(summary = "List schedules", description = "List schedules of an owner or of a mail account")
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> listSchedules(
            @Parameter(description = "Owner ID filter") @RequestParam(required = false) String ownerId,
            @Parameter(description = "Mail account ID filter") @RequestParam(required = false) String accountId) {
        if (ownerId != null) {
            return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getSchedulesByOwner(ownerId)));
        }
        if (accountId != null) {
            return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getSchedulesByAccount(accountId)));
        }
        throw new IllegalArgumentException("Either ownerId or accountId is required");
    }

    // === Schedule Update / Delete ===

    @PutMapping("/{scheduleId}")
    @Operation(summary = "Update a schedule", description = "Apply the provided fields to a schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> updateSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @Valid @RequestBody UpdateScheduleRequest request) {
        log.info("API: Update schedule {}", scheduleId);

        var response = scheduleManagementService.updateSchedule(scheduleId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule updated successfully"));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "Delete a schedule", description = "Delete a schedule and its execution history")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        log.info("API: Delete schedule {}", scheduleId);

        scheduleManagementService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(null, "Schedule deleted successfully"));
    }

    // === Execution ===

    @PostMapping("/{scheduleId}/execute")
    @Operation(summary = "Execute now", description = "Run a schedule immediately and return the resulting execution")
    public ResponseEntity<ApiResponse<ExecutionResponse>> executeNow(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        log.info("API: Execute schedule {} now", scheduleId);

        var execution = scheduleManagementService.executeNow(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(execution, "Execution " + execution.getStatus().getDisplayName()));
    }

    @GetMapping("/{scheduleId}/executions/latest")
    @Operation(summary = "Latest execution status", description = "Progress, timing and error of the most recent execution")
    public ResponseEntity<ApiResponse<ExecutionStatusResponse>> getLatestExecutionStatus(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        return scheduleManagementService.getLatestExecutionStatus(scheduleId)
                .map(status -> ResponseEntity.ok(ApiResponse.success(status)))
                .orElse(ResponseEntity.ok(ApiResponse.success(null, "Schedule has not been executed yet")));
    }

    // === Validation ===

    @PostMapping("/validate")
    @Operation(summary = "Validate a configuration", description = "Report errors, warnings and conflicts without saving anything")
    public ResponseEntity<ApiResponse<ValidationResult>> validateConfiguration(
            @Valid @RequestBody CreateScheduleRequest request,
            @Parameter(description = "Schedule being edited, left out of conflict detection")
            @RequestParam(required = false) UUID excludeScheduleId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.validateConfiguration(request, excludeScheduleId)));
    }

    @PostMapping("/conflicts")
    @Operation(summary = "Check timing conflicts", description = "List existing schedules colliding with a candidate timing")
    public ResponseEntity<ApiResponse<ConflictCheckResponse>> checkConflicts(@Valid @RequestBody ConflictCheckRequest request) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.checkConflicts(request)));
    }

    // === Calendar / Analytics ===

    @GetMapping("/calendar")
    @Operation(summary = "Upcoming runs", description = "Next occurrences of every enabled recurring schedule")
    public ResponseEntity<ApiResponse<List<CalendarEntry>>> getCalendar(
            @Parameter(description = "Occurrences per schedule")
            @RequestParam(required = false) @Min(1) @Max(100) Integer occurrences) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getCalendar(occurrences)));
    }

    @GetMapping("/analytics/{ownerId}")
    @Operation(summary = "Owner analytics", description = "Schedule and execution statistics of one owner")
    public ResponseEntity<ApiResponse<ScheduleAnalytics>> getAnalytics(@Parameter(description = "Owner ID") @PathVariable String ownerId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getAnalytics(ownerId)));
    }

    // === Bulk Operations ===

    @PostMapping("/bulk/enabled")
    @Operation(summary = "Bulk enable/disable", description = "Enable or disable several schedules at once")
    public ResponseEntity<ApiResponse<BulkOperationResult>> bulkSetEnabled(@Valid @RequestBody BulkScheduleRequest request) {
        log.info("API: Bulk set enabled={} on {} schedules", request.getEnabled(), request.getScheduleIds().size());

        var result = scheduleManagementService.bulkSetEnabled(request.getScheduleIds(), request.getEnabled());
        return ResponseEntity.ok(ApiResponse.success(result,
                String.format("Updated %d schedules, %d failed", result.getUpdated().size(), result.getErrors().size())));
    }
}
