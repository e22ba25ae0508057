package com.buddy.engine.model;

import com.buddy.engine.error.InvalidTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One tracked unit of supervised work.
 *
 * All mutable state is guarded by the instance monitor. Writes go through
 * {@link #apply(JobPatch)} only, which validates the whole patch before
 * touching anything, so a rejected patch leaves the job exactly as it was.
 * Every successful patch wakes threads blocked in {@link #awaitOutput}.
 *
 * The owning execution is the single writer; everyone else reads
 * {@link JobSnapshot}s or the incremental {@link OutputView}.
 */
public final class Job {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String              id;
    private final String              type;
    private final String              target;
    private final Map<String, String> params;
    private final Instant             startedAt;
    // Creation order; breaks ties between jobs started in the same instant.
    private final long                sequence = SEQUENCE.incrementAndGet();

    private final List<String> output = new ArrayList<>();
    private JobStatus    status = JobStatus.PENDING;
    private int          progress;
    private Instant      completedAt;
    private String       error;
    private List<String> diffOutput;
    private String       phase;

    public Job(String id, String type, String target, Map<String, String> params, Instant startedAt) {
        this.id        = id;
        this.type      = type;
        this.target    = target;
        this.params    = params == null ? Map.of() : Map.copyOf(params);
        this.startedAt = startedAt;
    }

    /**
     * Rebuild a read-only terminal job from an archived snapshot, so late
     * subscribers can replay a job that is no longer held in memory.
     */
    public static Job restore(JobSnapshot s) {
        Job job = new Job(s.id(), s.type(), s.target(), s.params(), s.startedAt());
        job.output.addAll(s.output());
        job.status      = s.status();
        job.progress    = s.progress();
        job.completedAt = s.completedAt();
        job.error       = s.error();
        job.diffOutput  = s.diffOutput();
        job.phase       = s.phase();
        return job;
    }

    public String getId()     { return id; }
    public String getType()   { return type; }
    public String getTarget() { return target; }
    public Instant getStartedAt() { return startedAt; }
    public long   getSequence() { return sequence; }

    public synchronized JobStatus getStatus() { return status; }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(id, type, target, params, status, progress,
                List.copyOf(output), startedAt, completedAt, error, diffOutput, phase);
    }

    /**
     * Apply a patch atomically.
     *
     * @throws InvalidTransitionException if the job is terminal or the
     *         requested status change is not an edge of the state machine
     */
    public synchronized JobSnapshot apply(JobPatch patch) {
        JobStatus next = patch.status() == null ? status : patch.status();
        if (status.isTerminal()) {
            throw new InvalidTransitionException(id, status, next);
        }
        if (next != status && !status.canTransitionTo(next)) {
            throw new InvalidTransitionException(id, status, next);
        }

        if (patch.lines() != null) {
            output.addAll(patch.lines());
        }
        if (patch.progress() != null) {
            // Clamp to 0..100 and never move backwards within a run.
            progress = Math.max(progress, Math.min(100, Math.max(0, patch.progress())));
        }
        if (patch.phase() != null)      phase = patch.phase();
        if (patch.diffOutput() != null) diffOutput = patch.diffOutput();
        if (patch.error() != null)      error = patch.error();

        if (next != status) {
            status = next;
            if (next.isTerminal()) {
                completedAt = Instant.now();
            }
        }
        notifyAll();
        return snapshot();
    }

    /**
     * Block until the output grows past {@code cursor}, the job becomes
     * terminal, or the timeout elapses. Returns every line from
     * {@code cursor} to the current end together with the status observed
     * at the same moment, so a terminal status here means no more lines.
     */
    public synchronized OutputView awaitOutput(int cursor, long timeoutMillis) throws InterruptedException {
        long deadline = System.nanoTime() + timeoutMillis * 1_000_000L;
        while (output.size() <= cursor && !status.isTerminal()) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                break;
            }
            wait(remainingMillis);
        }
        List<String> lines = cursor < output.size()
                ? List.copyOf(output.subList(cursor, output.size()))
                : List.of();
        return new OutputView(lines, status);
    }

    /** Lines read past a subscriber's cursor plus the status seen with them. */
    public record OutputView(List<String> lines, JobStatus status) {}
}
