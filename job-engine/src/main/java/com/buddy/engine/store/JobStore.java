package com.buddy.engine.store;

import com.buddy.engine.error.JobNotFoundException;
import com.buddy.engine.model.Job;
import com.buddy.engine.model.JobPatch;
import com.buddy.engine.model.JobSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Authoritative registry of jobs for this process.
 *
 * Live jobs are held in memory; every job that reaches a terminal state is
 * also handed to the {@link JobArchive}, so a job evicted by {@link #clear()}
 * (or left over from an earlier run) is still readable as a stable terminal
 * record. The store never spawns or kills anything. Cancellation is the
 * controller's business and must happen before {@link #clear()}.
 */
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private static final Comparator<Job> NEWEST_FIRST =
            Comparator.comparing(Job::getStartedAt)
                    .thenComparingLong(Job::getSequence)
                    .reversed();

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final JobArchive archive;
    private final int        recentLimit;

    public JobStore(JobArchive archive, int recentLimit) {
        this.archive     = archive;
        this.recentLimit = recentLimit;
    }

    // ------------------------------------------------------------------
    // Create / read
    // ------------------------------------------------------------------

    public JobSnapshot create(String type, String target, Map<String, String> params) {
        Job job = new Job(UUID.randomUUID().toString(), type, target, params, Instant.now());
        jobs.put(job.getId(), job);
        log.info("Created job {} (type={}, target={})", job.getId(), type, target);
        return job.snapshot();
    }

    /** Snapshot of a job, falling back to the archive for evicted jobs. */
    public Optional<JobSnapshot> get(String id) {
        Job job = jobs.get(id);
        if (job != null) {
            return Optional.of(job.snapshot());
        }
        return archive.find(id);
    }

    /**
     * The live record for owners and subscribers. Archived jobs come back as
     * a restored, read-only terminal job.
     */
    public Optional<Job> find(String id) {
        Job job = jobs.get(id);
        if (job != null) {
            return Optional.of(job);
        }
        return archive.find(id).map(Job::restore);
    }

    /**
     * Newest first. With {@code activeOnly} only non-terminal jobs are
     * returned; otherwise live jobs are merged with the most recent archived
     * ones, capped at the recent-jobs limit.
     */
    public List<JobSnapshot> list(boolean activeOnly) {
        List<JobSnapshot> live = jobs.values().stream()
                .sorted(NEWEST_FIRST)
                .map(Job::snapshot)
                .toList();
        if (activeOnly) {
            return live.stream().filter(s -> s.status().isActive()).toList();
        }
        Set<String> seen = new HashSet<>();
        live.forEach(s -> seen.add(s.id()));
        return Stream.concat(live.stream(),
                        archive.recent(recentLimit).stream().filter(s -> !seen.contains(s.id())))
                .sorted(Comparator.comparing(JobSnapshot::startedAt).reversed())
                .limit(Math.max(recentLimit, live.size()))
                .toList();
    }

    public List<JobSnapshot> activeJobs() {
        return list(true);
    }

    public int activeCount() {
        return (int) jobs.values().stream().filter(j -> j.getStatus().isActive()).count();
    }

    // ------------------------------------------------------------------
    // Mutation (owners only)
    // ------------------------------------------------------------------

    /**
     * Apply a patch atomically. Terminal transitions are archived after the
     * job's monitor is released.
     *
     * @throws JobNotFoundException if the job is not live in memory
     * @throws com.buddy.engine.error.InvalidTransitionException if the patch
     *         breaks the state machine; the job is unchanged
     */
    public JobSnapshot update(String id, JobPatch patch) {
        Job job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        JobSnapshot updated = job.apply(patch);
        if (patch.status() != null && updated.isTerminal()) {
            log.info("Job {} finished: {}{}", id, updated.status().wireName(),
                    updated.error() == null ? "" : " (" + updated.error() + ")");
            archive.save(updated);
        }
        return updated;
    }

    public JobSnapshot appendOutput(String id, String line) {
        return update(id, JobPatch.lines(line));
    }

    /**
     * Evict every terminal job from memory and return how many were removed.
     * Jobs that are still active are kept: nothing live ever disappears from
     * under its owner or its subscribers.
     */
    public int clear() {
        int removed = 0;
        for (Job job : List.copyOf(jobs.values())) {
            if (job.getStatus().isTerminal()) {
                jobs.remove(job.getId());
                removed++;
            } else {
                log.warn("Job {} still {} during clear; keeping it", job.getId(), job.getStatus().wireName());
            }
        }
        log.info("Cleared {} job(s) from memory", removed);
        return removed;
    }
}
