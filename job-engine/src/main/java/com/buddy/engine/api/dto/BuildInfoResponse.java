package com.buddy.engine.api.dto;

import com.buddy.engine.store.BuildRecordEntity;

import java.time.Instant;

public record BuildInfoResponse(
        String  type,
        String  jobId,
        Instant lastBuiltAt,
        String  lastBuildStatus) {

    public static BuildInfoResponse from(BuildRecordEntity row) {
        return new BuildInfoResponse(row.getJobType(), row.getJobId(), row.getLastBuiltAt(), row.getLastBuildStatus());
    }
}
