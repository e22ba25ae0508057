package com.buddy.engine.api.dto;

import com.buddy.engine.model.JobSnapshot;

/** {@code {"job": {...}}}, the body of every single-job response. */
public record JobEnvelope(JobResponse job) {

    public static JobEnvelope of(JobSnapshot job) {
        return new JobEnvelope(JobResponse.from(job));
    }
}
