package com.example.emailscheduler.dto;

import com.example.emailscheduler.domain.enums.LlmFocus;
import com.example.emailscheduler.domain.enums.ScheduleType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Partial update of a schedule. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduleRequest {

    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    private String description;

    private ScheduleType type;

    private Instant dateRangeFrom;

    private Instant dateRangeTo;

    private String cronExpression;

    private String timezone;

    private List<Instant> specificDates;

    private Boolean enabled;

    @Min(value = 1, message = "Batch size must be at least 1")
    @Max(value = 100, message = "Batch size must be at most 100")
    private Integer batchSize;

    private Map<String, String> categoryPriorities;

    private Map<String, String> senderPriorities;

    private LlmFocus llmFocus;

    /**
     * Whether any field that drives next-run calculation is present
     */
    public boolean changesTiming() {
        return type != null || dateRangeFrom != null || dateRangeTo != null || cronExpression != null
                || timezone != null || specificDates != null;
    }
}
