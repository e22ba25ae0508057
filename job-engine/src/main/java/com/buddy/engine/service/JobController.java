package com.buddy.engine.service;

import com.buddy.engine.approval.ApprovalDecision;
import com.buddy.engine.approval.ApprovalGate;
import com.buddy.engine.definition.CommandTemplate;
import com.buddy.engine.definition.JobDefinition;
import com.buddy.engine.definition.JobDefinitionRegistry;
import com.buddy.engine.error.InvalidTransitionException;
import com.buddy.engine.error.JobNotFoundException;
import com.buddy.engine.error.NotAwaitingApprovalException;
import com.buddy.engine.model.JobPatch;
import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;
import com.buddy.engine.policy.ConcurrencyPolicy;
import com.buddy.engine.policy.EnvironmentPolicy;
import com.buddy.engine.store.JobStore;
import com.buddy.engine.stream.OutputBroadcaster;
import com.buddy.engine.stream.OutputSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The engine's front door. Every collaborator (HTTP layer, tests, other
 * tools) goes through here.
 *
 * Holds no job state of its own: it validates requests, creates jobs in the
 * {@link JobStore}, and routes control signals to each job's owner.
 */
@Service
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    public static final String USER_CANCEL_REASON  = "Cancelled by user";
    public static final String CLEAR_CANCEL_REASON = "Force-killed by clear";

    // Slack on top of the grace period for the owner to notice the exit.
    private static final Duration SETTLE_SLACK = Duration.ofSeconds(1);

    private final JobDefinitionRegistry registry;
    private final JobStore              store;
    private final JobRunner             runner;
    private final ApprovalGate          gate;
    private final OutputBroadcaster     broadcaster;
    private final EnvironmentPolicy     environmentPolicy;
    private final ConcurrencyPolicy     concurrencyPolicy;

    public JobController(JobDefinitionRegistry registry,
                         JobStore store,
                         JobRunner runner,
                         ApprovalGate gate,
                         OutputBroadcaster broadcaster,
                         EnvironmentPolicy environmentPolicy,
                         ConcurrencyPolicy concurrencyPolicy) {
        this.registry          = registry;
        this.store             = store;
        this.runner            = runner;
        this.gate              = gate;
        this.broadcaster       = broadcaster;
        this.environmentPolicy = environmentPolicy;
        this.concurrencyPolicy = concurrencyPolicy;
    }

    // ------------------------------------------------------------------
    // Create / read
    // ------------------------------------------------------------------

    /**
     * Validate and start a job. Nothing is created or spawned unless every
     * check passes.
     *
     * @throws IllegalArgumentException if type or target is missing, or a
     *         required param is absent
     * @throws com.buddy.engine.error.UnknownJobTypeException   unknown type
     * @throws com.buddy.engine.error.PolicyViolationException  protected environment
     * @throws com.buddy.engine.error.ActiveJobLimitException   too many active jobs
     */
    public JobSnapshot create(CreateJobCommand command) {
        if (isBlank(command.type()) || isBlank(command.target())) {
            throw new IllegalArgumentException("Missing type or target");
        }
        JobDefinition definition = registry.get(command.type());
        List<String> missing = definition.missingParams(command.params());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing required parameter(s) for "
                    + definition.type() + ": " + String.join(", ", missing));
        }
        environmentPolicy.check(definition, command.params());
        String environment = environmentPolicy.environmentFor(command.params());

        JobSnapshot job;
        synchronized (this) {
            concurrencyPolicy.check(store.activeCount());
            job = store.create(command.type(), command.target(), command.params());
        }
        runner.start(job, definition,
                CommandTemplate.variables(job.id(), job.target(), environment, job.params()));
        return job;
    }

    public Optional<JobSnapshot> findById(String id) {
        return store.get(id);
    }

    /** @throws JobNotFoundException if the job is unknown */
    public JobSnapshot get(String id) {
        return store.get(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    public List<JobSnapshot> list(boolean activeOnly) {
        return store.list(activeOnly);
    }

    public List<JobDefinition> jobTypes() {
        return registry.all();
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    public JobSnapshot cancel(String id) {
        return cancel(id, USER_CANCEL_REASON);
    }

    /**
     * Stop a job and wait for it to settle. Cancelling a job that has
     * already finished changes nothing and returns its final state.
     *
     * @throws JobNotFoundException if the job is unknown
     */
    public JobSnapshot cancel(String id, String reason) {
        JobSnapshot job = get(id);
        if (job.isTerminal()) {
            return job;
        }
        log.info("Cancelling job {} ({})", id, reason);
        if (runner.cancel(id, reason)) {
            if (!runner.awaitSettled(id, settleTimeout())) {
                log.warn("Job {} did not settle within {} ms of cancel", id, settleTimeout().toMillis());
            }
        } else {
            settleWithoutOwner(id, reason);
        }
        return get(id);
    }

    /**
     * Cancel every active job, wait for them to settle, and drop finished
     * jobs from memory. Dropped jobs stay readable from the archive.
     *
     * @return how many active jobs were force-terminated
     */
    public int clear() {
        List<JobSnapshot> active = store.activeJobs();
        for (JobSnapshot job : active) {
            if (!runner.cancel(job.id(), CLEAR_CANCEL_REASON)) {
                settleWithoutOwner(job.id(), CLEAR_CANCEL_REASON);
            }
        }
        for (JobSnapshot job : active) {
            if (!runner.awaitSettled(job.id(), settleTimeout())) {
                log.warn("Job {} did not settle within {} ms of clear", job.id(), settleTimeout().toMillis());
            }
        }
        int evicted = store.clear();
        log.info("Clear terminated {} active job(s), evicted {}", active.size(), evicted);
        return active.size();
    }

    /**
     * Answer a job's approval question.
     *
     * @throws JobNotFoundException                            unknown job
     * @throws NotAwaitingApprovalException                    nothing to answer
     * @throws com.buddy.engine.error.AlreadyRespondedException answered before
     */
    public ApprovalDecision respond(String id, boolean approved) {
        return gate.respond(id, approved);
    }

    /** @throws JobNotFoundException if the job is unknown */
    public OutputSubscription subscribe(String id) {
        return broadcaster.subscribe(id);
    }

    /**
     * The job's captured preview.
     *
     * @throws NotAwaitingApprovalException if the job never produced one
     */
    public JobSnapshot diff(String id) {
        JobSnapshot job = get(id);
        if (job.diffOutput() == null) {
            throw new NotAwaitingApprovalException(id, job.status());
        }
        return job;
    }

    // ------------------------------------------------------------------

    // An active job whose owner is gone; only reachable after an owner crash.
    private void settleWithoutOwner(String id, String reason) {
        try {
            store.update(id, JobPatch.status(JobStatus.CANCELLED).withError(reason));
        } catch (InvalidTransitionException e) {
            log.debug("Job {} settled concurrently as {}", id, e.getFrom().wireName());
        }
    }

    private Duration settleTimeout() {
        return runner.settings().cancelGracePeriod().plus(SETTLE_SLACK);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
