package com.buddy.engine.approval;

import com.buddy.engine.error.AlreadyRespondedException;
import com.buddy.engine.error.JobNotFoundException;
import com.buddy.engine.error.NotAwaitingApprovalException;
import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;
import com.buddy.engine.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Rendezvous between a job's owner, parked after its preview phase, and the
 * human who approves or rejects the change.
 *
 * The owner opens a checkpoint, publishes {@code awaiting_approval}, then
 * blocks in {@link #await}. A responder never touches the job itself: it only
 * records a decision, which the owner turns into the next transition. The
 * last checkpoint of a job stays registered until the owner closes it, so a
 * repeated answer is reported as already decided rather than silently lost.
 */
@Component
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final Map<String, ApprovalCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final JobStore store;

    public ApprovalGate(JobStore store) {
        this.store = store;
    }

    // ------------------------------------------------------------------
    // Owner side
    // ------------------------------------------------------------------

    /** Register a fresh checkpoint, replacing any decided one from an earlier phase. */
    public ApprovalCheckpoint open(String jobId) {
        ApprovalCheckpoint checkpoint = new ApprovalCheckpoint(jobId);
        ApprovalCheckpoint previous = checkpoints.put(jobId, checkpoint);
        if (previous != null && !previous.isDecided()) {
            previous.decide(ApprovalDecision.CANCELLED);
        }
        log.debug("Approval checkpoint opened for job {}", jobId);
        return checkpoint;
    }

    /**
     * Block until the checkpoint is decided.
     *
     * @param timeout null waits indefinitely; otherwise an undecided
     *                checkpoint is resolved as {@link ApprovalDecision#TIMED_OUT}
     */
    public ApprovalDecision await(ApprovalCheckpoint checkpoint, Duration timeout) throws InterruptedException {
        try {
            if (timeout == null) {
                return checkpoint.future().get();
            }
            return checkpoint.future().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (checkpoint.decide(ApprovalDecision.TIMED_OUT)) {
                log.info("Approval for job {} timed out after {}", checkpoint.jobId(), timeout);
            }
            return checkpoint.future().join();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Approval checkpoint for job " + checkpoint.jobId() + " failed", e.getCause());
        }
    }

    /** Drop the job's checkpoint once the owner is done with it. */
    public void close(ApprovalCheckpoint checkpoint) {
        checkpoints.remove(checkpoint.jobId(), checkpoint);
    }

    // ------------------------------------------------------------------
    // Control signals
    // ------------------------------------------------------------------

    /**
     * Record a human decision for a job awaiting approval.
     *
     * @throws JobNotFoundException         if the job is unknown
     * @throws NotAwaitingApprovalException if the job has no open question
     * @throws AlreadyRespondedException    if the question was already answered
     */
    public ApprovalDecision respond(String jobId, boolean approved) {
        JobSnapshot job = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        ApprovalCheckpoint checkpoint = checkpoints.get(jobId);
        if (checkpoint == null) {
            throw new NotAwaitingApprovalException(jobId, job.status());
        }
        if (checkpoint.isDecided()) {
            throw new AlreadyRespondedException(jobId);
        }
        // Opened but the owner has not published awaiting_approval yet.
        if (job.status() != JobStatus.AWAITING_APPROVAL) {
            throw new NotAwaitingApprovalException(jobId, job.status());
        }
        ApprovalDecision decision = ApprovalDecision.of(approved);
        if (!checkpoint.decide(decision)) {
            throw new AlreadyRespondedException(jobId);
        }
        log.info("Job {} {} by user after {} s", jobId, approved ? "approved" : "rejected",
                Duration.between(checkpoint.openedAt(), Instant.now()).toSeconds());
        return decision;
    }

    /**
     * Wake an owner parked on the job's checkpoint with {@code decision}
     * (used by cancel and clear). No-op when nothing is waiting.
     */
    public boolean release(String jobId, ApprovalDecision decision) {
        ApprovalCheckpoint checkpoint = checkpoints.get(jobId);
        return checkpoint != null && checkpoint.decide(decision);
    }

    public boolean isWaiting(String jobId) {
        ApprovalCheckpoint checkpoint = checkpoints.get(jobId);
        return checkpoint != null && !checkpoint.isDecided();
    }
}
