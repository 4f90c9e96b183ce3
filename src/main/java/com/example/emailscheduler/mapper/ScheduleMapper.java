package com.example.emailscheduler.mapper;

import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.entity.ScheduleExecution;
import com.example.emailscheduler.dto.CreateScheduleRequest;
import com.example.emailscheduler.dto.ExecutionResponse;
import com.example.emailscheduler.dto.ScheduleResponse;
import com.example.emailscheduler.dto.UpdateScheduleRequest;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValueCheckStrategy;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduleMapper {

    /**
     * Build a new schedule from a create request. Null request fields keep the entity defaults.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "defaultSchedule", ignore = true)
    @Mapping(target = "nextExecutionAt", ignore = true)
    @Mapping(target = "lastExecutedAt", ignore = true)
    @Mapping(target = "totalExecutions", ignore = true)
    @Mapping(target = "successfulExecutions", ignore = true)
    @Mapping(target = "failedExecutions", ignore = true)
    @Mapping(target = "version", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "timezone", ignore = true)
    @Mapping(target = "specificDates", ignore = true)
    @Mapping(target = "categoryPriorities", ignore = true)
    @Mapping(target = "senderPriorities", ignore = true)
    @BeanMapping(nullValueCheckStrategy = NullValueCheckStrategy.ALWAYS)
    ProcessingSchedule toEntity(CreateScheduleRequest request);

    /**
     * Copy the non-null fields of an update request onto an existing schedule.
     * Collections are replaced by the service so the element collection keeps its identity.
     */
    @Mapping(target = "specificDates", ignore = true)
    @Mapping(target = "categoryPriorities", ignore = true)
    @Mapping(target = "senderPriorities", ignore = true)
    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    void updateEntity(UpdateScheduleRequest request, @MappingTarget ProcessingSchedule schedule);

    ScheduleResponse toResponse(ProcessingSchedule schedule);

    List<ScheduleResponse> toResponseList(List<ProcessingSchedule> schedules);

    ExecutionResponse toExecutionResponse(ScheduleExecution execution);

    List<ExecutionResponse> toExecutionResponses(List<ScheduleExecution> executions);
}
