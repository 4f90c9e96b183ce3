package com.example.emailscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictCheckResponse {

    private boolean hasConflicts;
    private List<ScheduleConflict> conflicts;
}
