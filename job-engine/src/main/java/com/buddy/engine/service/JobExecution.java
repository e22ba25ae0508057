package com.buddy.engine.service;

import com.buddy.engine.approval.ApprovalCheckpoint;
import com.buddy.engine.approval.ApprovalDecision;
import com.buddy.engine.approval.ApprovalGate;
import com.buddy.engine.definition.CommandTemplate;
import com.buddy.engine.definition.JobDefinition;
import com.buddy.engine.definition.PhaseDefinition;
import com.buddy.engine.error.InvalidTransitionException;
import com.buddy.engine.error.SpawnException;
import com.buddy.engine.model.JobPatch;
import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;
import com.buddy.engine.process.ProcessSpec;
import com.buddy.engine.process.ProcessSupervisor;
import com.buddy.engine.process.SupervisedProcess;
import com.buddy.engine.process.TerminationResult;
import com.buddy.engine.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.regex.Matcher;

/**
 * Owner of one job: the only code that moves it through its states.
 *
 * Runs the job type's phases in order on a worker thread. Everyone else
 * talks to it through control signals: {@link #requestCancel} from the
 * controller, and approval decisions that arrive through the
 * {@link ApprovalGate}.
 *
 * Cancellation and output share one lock. Once a cancel request is
 * recorded no further process line reaches the job, so the output of a
 * cancelled job ends with what viewers had seen when they cancelled.
 */
class JobExecution implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobExecution.class);

    static final String NO_CHANGES_LINE = "✓ No changes to deploy - stack is up to date";
    static final String AWAITING_LINE   = "Changes detected - waiting for approval...";
    static final String APPROVED_LINE   = "✓ Deploy approved by user";
    static final String REJECTED_LINE   = "✗ Deploy rejected by user";
    static final String REJECTED_ERROR  = "Rejected by user";

    // Lines quoted in the error of a failed job.
    private static final int TAIL_LINES = 3;

    private final String              jobId;
    private final JobDefinition       definition;
    private final Map<String, String> variables;
    private final JobStore            store;
    private final ProcessSupervisor   supervisor;
    private final ApprovalGate        gate;
    private final ExecutionSettings   settings;
    private final Consumer<JobSnapshot> onSettled;

    private final AtomicBoolean                      claimed  = new AtomicBoolean();
    private final AtomicBoolean                      reported = new AtomicBoolean();
    private final CountDownLatch                     settled  = new CountDownLatch(1);
    private final AtomicReference<SupervisedProcess> current  = new AtomicReference<>();

    private final Object        outputLock = new Object();
    private final Deque<String> tail       = new ArrayDeque<>();   // guarded by outputLock
    private String              cancelReason;                       // guarded by outputLock

    // Owner thread only.
    private ApprovalCheckpoint checkpoint;

    JobExecution(String jobId,
                 JobDefinition definition,
                 Map<String, String> variables,
                 JobStore store,
                 ProcessSupervisor supervisor,
                 ApprovalGate gate,
                 ExecutionSettings settings,
                 Consumer<JobSnapshot> onSettled) {
        this.jobId      = jobId;
        this.definition = definition;
        this.variables  = variables;
        this.store      = store;
        this.supervisor = supervisor;
        this.gate       = gate;
        this.settings   = settings;
        this.onSettled  = onSettled;
    }

    String jobId() { return jobId; }

    // ------------------------------------------------------------------
    // Owner thread
    // ------------------------------------------------------------------

    @Override
    public void run() {
        if (!claimed.compareAndSet(false, true)) {
            // Cancelled while queued; the canceller settled it.
            return;
        }
        MDC.put("jobId",   jobId);
        MDC.put("jobType", definition.type());
        try {
            log.info("Running job {} ({} phase(s))", jobId, definition.phases().size());
            execute();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} interrupted; engine is shutting down", jobId);
            settle(JobPatch.status(JobStatus.CANCELLED).withError("Engine shut down"));
        } catch (Exception e) {
            log.error("Unhandled error in job {}: {}", jobId, e.getMessage(), e);
            settle(JobPatch.status(JobStatus.FAILED).withError("Unexpected error: " + e.getMessage()));
        } finally {
            if (checkpoint != null) {
                gate.close(checkpoint);
            }
            reportSettled();
            MDC.clear();
        }
    }

    private void execute() throws InterruptedException {
        List<PhaseDefinition> phases = definition.phases();
        for (int i = 0; i < phases.size(); i++) {
            PhaseDefinition phase = phases.get(i);
            if (isCancelRequested()) {
                settleCancelled();
                return;
            }

            ProcessSpec spec;
            try {
                spec = CommandTemplate.resolve(phase, variables);
            } catch (IllegalArgumentException e) {
                settleOutcome(JobPatch.status(JobStatus.FAILED).withError(e.getMessage()));
                return;
            }

            List<String> captured = phase.preview() ? Collections.synchronizedList(new ArrayList<>()) : null;
            int exitCode;
            try (SupervisedProcess process = supervisor.spawn(spec, line -> onLine(line, captured))) {
                current.set(process);
                if (isCancelRequested()) {
                    terminate(process);
                } else {
                    publish(JobPatch.status(JobStatus.RUNNING).withPhase(phase.name()));
                    log.info("Phase '{}' started (pid {}): {}", phase.name(), process.pid(), spec.describe());
                }
                exitCode = process.awaitExit();
            } catch (SpawnException e) {
                log.warn("Job {} could not start phase '{}': {}", jobId, phase.name(), e.getMessage());
                settleOutcome(JobPatch.status(JobStatus.FAILED).withPhase(phase.name()).withError(e.getMessage()));
                return;
            } finally {
                current.set(null);
            }

            if (isCancelRequested()) {
                settleCancelled();
                return;
            }
            if (!phase.isSuccess(exitCode)) {
                settleOutcome(JobPatch.status(JobStatus.FAILED).withError(exitFailure(exitCode)));
                return;
            }
            log.info("Phase '{}' exited with {}", phase.name(), exitCode);

            if (phase.preview()) {
                List<String> diff = List.copyOf(captured);
                if (exitCode == 0 && !phase.hasChanges(diff)) {
                    settleOutcome(JobPatch.status(JobStatus.COMPLETED).withProgress(100)
                            .withLines(List.of(NO_CHANGES_LINE)));
                    return;
                }
                if (!awaitApproval(diff)) {
                    return;
                }
            }

            if (i < phases.size() - 1) {
                publish(JobPatch.status(JobStatus.RUNNING).withProgress(100 * (i + 1) / phases.size()));
            }
        }
        settleOutcome(JobPatch.status(JobStatus.COMPLETED).withProgress(100));
    }

    /**
     * Park until the preview is approved. Returns true if the remaining
     * phases should run; otherwise the job has already been settled.
     */
    private boolean awaitApproval(List<String> diff) throws InterruptedException {
        checkpoint = gate.open(jobId);
        boolean published = publish(JobPatch.status(JobStatus.AWAITING_APPROVAL)
                .withDiffOutput(diff)
                .withLines(List.of(AWAITING_LINE)));
        if (!published) {
            settleCancelled();
            return false;
        }
        log.info("Job {} awaiting approval ({} preview line(s))", jobId, diff.size());

        ApprovalDecision decision = gate.await(checkpoint, settings.approvalTimeout());
        switch (decision) {
            case APPROVED -> {
                if (publish(JobPatch.status(JobStatus.RUNNING).withLines(List.of(APPROVED_LINE)))) {
                    return true;
                }
                settleCancelled();
            }
            case REJECTED -> settleOutcome(JobPatch.status(JobStatus.CANCELLED)
                    .withError(REJECTED_ERROR)
                    .withLines(List.of(REJECTED_LINE)));
            case TIMED_OUT -> settleOutcome(JobPatch.status(JobStatus.CANCELLED)
                    .withError("Approval timed out after " + settings.approvalTimeout().toSeconds() + "s")
                    .withLines(List.of(REJECTED_LINE)));
            case CANCELLED -> settleCancelled();
        }
        return false;
    }

    private void onLine(String line, List<String> captured) {
        synchronized (outputLock) {
            if (cancelReason != null) {
                return;
            }
            if (tail.size() == TAIL_LINES) {
                tail.removeFirst();
            }
            tail.addLast(line);
            if (captured != null) {
                captured.add(line);
            }
            JobPatch patch = JobPatch.lines(line);
            Integer progress = progressOf(line);
            if (progress != null) {
                patch = patch.withProgress(progress);
            }
            try {
                store.update(jobId, patch);
            } catch (InvalidTransitionException e) {
                log.debug("Dropped line for settled job {}", jobId);
            }
        }
    }

    private Integer progressOf(String line) {
        Matcher m = settings.progressPattern().matcher(line);
        if (!m.find() || m.groupCount() < 1) {
            return null;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String exitFailure(int exitCode) {
        synchronized (outputLock) {
            if (tail.isEmpty()) {
                return "Exit code " + exitCode;
            }
            return "Exit code " + exitCode + " (last output: " + String.join(" | ", tail) + ")";
        }
    }

    // ------------------------------------------------------------------
    // Control signals
    // ------------------------------------------------------------------

    /**
     * Ask the job to stop. A job that never started is settled right here;
     * otherwise a parked approval is released and the running process tree
     * is terminated, and the owner settles the job when it notices.
     */
    void requestCancel(String reason) {
        synchronized (outputLock) {
            if (cancelReason == null) {
                cancelReason = reason;
            }
        }
        if (claimed.compareAndSet(false, true)) {
            log.info("Job {} cancelled before it started", jobId);
            settleCancelled();
            reportSettled();
            return;
        }
        gate.release(jobId, ApprovalDecision.CANCELLED);
        SupervisedProcess process = current.get();
        if (process != null) {
            terminate(process);
        }
    }

    private void terminate(SupervisedProcess process) {
        TerminationResult result = process.terminate(settings.cancelGracePeriod());
        if (!result.clean()) {
            log.warn("Job {} left orphaned process(es) {} after cancelling {}",
                    jobId, result.survivors(), process.spec().describe());
        }
    }

    boolean awaitSettled(Duration timeout) throws InterruptedException {
        return settled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    boolean isCancelRequested() {
        synchronized (outputLock) {
            return cancelReason != null;
        }
    }

    // ------------------------------------------------------------------
    // Store writes
    // ------------------------------------------------------------------

    /** Apply a non-terminal patch unless a cancel is pending. */
    private boolean publish(JobPatch patch) {
        synchronized (outputLock) {
            if (cancelReason != null) {
                return false;
            }
            store.update(jobId, patch);
            return true;
        }
    }

    /** Settle with {@code patch}, or as cancelled if a cancel got in first. */
    private void settleOutcome(JobPatch patch) {
        synchronized (outputLock) {
            settle(cancelReason != null ? cancelledPatch() : patch);
        }
    }

    private void settleCancelled() {
        settle(cancelledPatch());
    }

    private JobPatch cancelledPatch() {
        synchronized (outputLock) {
            return JobPatch.status(JobStatus.CANCELLED).withError(cancelReason);
        }
    }

    private void settle(JobPatch patch) {
        try {
            store.update(jobId, patch);
        } catch (InvalidTransitionException e) {
            if (e.getFrom() == JobStatus.AWAITING_APPROVAL && e.getTo() == JobStatus.FAILED) {
                store.update(jobId, patch.withStatus(JobStatus.CANCELLED));
            } else {
                log.debug("Job {} already settled as {}", jobId, e.getFrom().wireName());
            }
        }
    }

    private void reportSettled() {
        if (!reported.compareAndSet(false, true)) {
            return;
        }
        settled.countDown();
        try {
            store.get(jobId).ifPresent(onSettled);
        } catch (RuntimeException e) {
            log.warn("Settlement listener failed for job {}: {}", jobId, e.getMessage());
        }
    }
}
