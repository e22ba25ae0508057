package com.buddy.engine.store;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Last build outcome for one target; a newer build overwrites the row.
 *
 * DB table: build_records  (created by Flyway V3 migration)
 */
@Entity
@Table(name = "build_records")
public class BuildRecordEntity {

    public static final String SUCCESS = "success";
    public static final String FAILED  = "failed";

    @Id
    private String target;

    @Column(name = "job_type", nullable = false)
    private String jobType;

    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    @Column(name = "last_build_status", nullable = false, length = 16)
    private String lastBuildStatus;

    @Column(name = "last_built_at", nullable = false)
    private Instant lastBuiltAt;

    protected BuildRecordEntity() {}   // required by JPA

    public BuildRecordEntity(String target) {
        this.target = target;
    }

    public String  getTarget()          { return target; }
    public String  getJobType()         { return jobType; }
    public String  getJobId()           { return jobId; }
    public String  getLastBuildStatus() { return lastBuildStatus; }
    public Instant getLastBuiltAt()     { return lastBuiltAt; }

    void update(String jobType, String jobId, String status, Instant builtAt) {
        this.jobType         = jobType;
        this.jobId           = jobId;
        this.lastBuildStatus = status;
        this.lastBuiltAt     = builtAt;
    }
}
