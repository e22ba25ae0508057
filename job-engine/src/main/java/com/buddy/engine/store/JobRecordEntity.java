package com.buddy.engine.store;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Archived copy of a job that reached a terminal state.
 *
 * List-valued fields (output, diff, params) are stored as JSON text; the
 * archive is only read back whole, never queried by content.
 *
 * DB table: job_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_records")
public class JobRecordEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String type;

    @Column(nullable = false)
    private String target;

    @Column(nullable = false, length = 32)
    private String status;

    @Column(nullable = false)
    private int progress;

    @Lob
    @Column(name = "output_json", nullable = false)
    private String outputJson;

    @Lob
    @Column(name = "diff_output_json")
    private String diffOutputJson;

    @Lob
    @Column(name = "params_json")
    private String paramsJson;

    @Column(length = 4000)
    private String error;

    @Column
    private String phase;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected JobRecordEntity() {}   // required by JPA

    public JobRecordEntity(String id, String type, String target) {
        this.id     = id;
        this.type   = type;
        this.target = target;
    }

    public String  getId()             { return id; }
    public String  getType()           { return type; }
    public String  getTarget()         { return target; }
    public String  getStatus()         { return status; }
    public int     getProgress()       { return progress; }
    public String  getOutputJson()     { return outputJson; }
    public String  getDiffOutputJson() { return diffOutputJson; }
    public String  getParamsJson()     { return paramsJson; }
    public String  getError()          { return error; }
    public String  getPhase()          { return phase; }
    public Instant getStartedAt()      { return startedAt; }
    public Instant getCompletedAt()    { return completedAt; }

    public void setStatus(String status)                 { this.status = status; }
    public void setProgress(int progress)                { this.progress = progress; }
    public void setOutputJson(String outputJson)         { this.outputJson = outputJson; }
    public void setDiffOutputJson(String diffOutputJson) { this.diffOutputJson = diffOutputJson; }
    public void setParamsJson(String paramsJson)         { this.paramsJson = paramsJson; }
    public void setError(String error)                   { this.error = error; }
    public void setPhase(String phase)                   { this.phase = phase; }
    public void setStartedAt(Instant t)                  { this.startedAt = t; }
    public void setCompletedAt(Instant t)                { this.completedAt = t; }
}
