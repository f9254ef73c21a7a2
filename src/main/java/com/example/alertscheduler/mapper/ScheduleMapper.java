package com.example.alertscheduler.mapper;

import com.example.alertscheduler.domain.entity.Schedule;
import com.example.alertscheduler.dto.ScheduleResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting schedules to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduleMapper {

    @Mapping(target = "isActive", source = "active")
    ScheduleResponse toResponse(Schedule schedule);

    List<ScheduleResponse> toResponseList(List<Schedule> schedules);
}
