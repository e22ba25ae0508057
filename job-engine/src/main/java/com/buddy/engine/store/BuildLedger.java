package com.buddy.engine.store;

import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Remembers when each target was last built and whether that build worked.
 *
 * Only completed and failed builds count; a cancelled build leaves the
 * previous record in place. Like the {@link JobArchive}, writes are best
 * effort and never affect the job that triggered them.
 */
public class BuildLedger {

    private static final Logger log = LoggerFactory.getLogger(BuildLedger.class);

    private final BuildRecordRepository repository;

    public BuildLedger(BuildRecordRepository repository) {
        this.repository = repository;
    }

    public void record(JobSnapshot job) {
        String status;
        if (job.status() == JobStatus.COMPLETED) {
            status = BuildRecordEntity.SUCCESS;
        } else if (job.status() == JobStatus.FAILED) {
            status = BuildRecordEntity.FAILED;
        } else {
            return;
        }
        try {
            BuildRecordEntity row = repository.findById(job.target())
                    .orElseGet(() -> new BuildRecordEntity(job.target()));
            Instant builtAt = job.completedAt() == null ? Instant.now() : job.completedAt();
            row.update(job.type(), job.id(), status, builtAt);
            repository.save(row);
            log.info("Recorded {} build of {} (job {})", status, job.target(), job.id());
        } catch (Exception e) {
            log.warn("Could not record build of {} (job {}): {}", job.target(), job.id(), e.getMessage());
        }
    }

    /** Every known target, alphabetically. */
    public List<BuildRecordEntity> all() {
        return repository.findAllByOrderByTargetAsc();
    }

    public Optional<BuildRecordEntity> find(String target) {
        return repository.findById(target);
    }
}
