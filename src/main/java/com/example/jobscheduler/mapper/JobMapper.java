package com.example.jobscheduler.mapper;

import com.example.jobscheduler.domain.entity.JobRun;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.JobRunResponse;
import com.example.jobscheduler.schedule.RecurrenceCatalog;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE, imports = RecurrenceCatalog.class)
public interface JobMapper {

    /**
     * Convert ScheduledJob entity to JobResponse DTO, describing its schedule
     */
    @Mapping(target = "scheduleDescription", expression = "java(RecurrenceCatalog.describe(job.getCronExpression()))")
    JobResponse toResponse(ScheduledJob job);

    List<JobResponse> toResponseList(List<ScheduledJob> jobs);

    JobRunResponse toRunResponse(JobRun run);

    List<JobRunResponse> toRunResponses(List<JobRun> runs);
}
