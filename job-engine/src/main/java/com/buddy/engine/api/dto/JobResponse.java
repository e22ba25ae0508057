package com.buddy.engine.api.dto;

import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Wire form of a job. {@code status} is lower-case, e.g. "awaiting_approval".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        String              id,
        String              type,
        String              target,
        Map<String, String> params,
        JobStatus           status,
        int                 progress,
        List<String>        output,
        Instant             startedAt,
        Instant             completedAt,
        String              error,
        List<String>        diffOutput,
        String              phase
) {
    public static JobResponse from(JobSnapshot job) {
        return new JobResponse(
                job.id(),
                job.type(),
                job.target(),
                job.params(),
                job.status(),
                job.progress(),
                job.output(),
                job.startedAt(),
                job.completedAt(),
                job.error(),
                job.diffOutput(),
                job.phase()
        );
    }
}
