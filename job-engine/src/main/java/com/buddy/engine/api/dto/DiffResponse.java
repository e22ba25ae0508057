package com.buddy.engine.api.dto;

import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;

import java.util.List;

/** Preview captured by a job's approval phase. */
public record DiffResponse(List<String> diffOutput, JobStatus status, String target) {

    public static DiffResponse from(JobSnapshot job) {
        return new DiffResponse(job.diffOutput(), job.status(), job.target());
    }
}
