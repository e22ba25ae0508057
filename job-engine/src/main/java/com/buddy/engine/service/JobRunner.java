package com.buddy.engine.service;

import com.buddy.engine.approval.ApprovalGate;
import com.buddy.engine.definition.JobDefinition;
import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.process.ProcessSupervisor;
import com.buddy.engine.store.BuildLedger;
import com.buddy.engine.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts one {@link JobExecution} per job on the worker pool and routes
 * control signals to it while it is alive.
 *
 * Metrics:
 * <pre>
 *   buddy.jobs.created{type}
 *   buddy.jobs.finished{type, status}
 *   buddy.jobs.duration{type}
 * </pre>
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final Map<String, JobExecution> executions = new ConcurrentHashMap<>();

    private final ExecutorService   workers;
    private final JobStore          store;
    private final ProcessSupervisor supervisor;
    private final ApprovalGate      gate;
    private final ExecutionSettings settings;
    private final BuildLedger       builds;
    private final MeterRegistry     meterRegistry;

    public JobRunner(@Qualifier("jobExecutor") ExecutorService workers,
                     JobStore store,
                     ProcessSupervisor supervisor,
                     ApprovalGate gate,
                     ExecutionSettings settings,
                     BuildLedger builds,
                     MeterRegistry meterRegistry) {
        this.workers       = workers;
        this.store         = store;
        this.supervisor    = supervisor;
        this.gate          = gate;
        this.settings      = settings;
        this.builds        = builds;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Owner threads, one per live job, held even while the job is parked
     * awaiting approval. Unbounded: live jobs are capped by
     * {@code ConcurrencyPolicy}, never by the pool.
     */
    public static ExecutorService newOwnerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Hand a freshly created job to a worker. */
    public void start(JobSnapshot job, JobDefinition definition, Map<String, String> variables) {
        JobExecution execution = new JobExecution(job.id(), definition, variables,
                store, supervisor, gate, settings, settled -> onSettled(settled, definition));
        executions.put(job.id(), execution);
        meterRegistry.counter("buddy.jobs.created", "type", job.type()).increment();
        try {
            workers.submit(execution);
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected job {}: {}", job.id(), e.getMessage());
            execution.requestCancel("Engine is shutting down");
        }
    }

    /**
     * Route a cancel request to the job's owner.
     *
     * @return false if no execution is tracked for the job
     */
    public boolean cancel(String jobId, String reason) {
        JobExecution execution = executions.get(jobId);
        if (execution == null) {
            return false;
        }
        execution.requestCancel(reason);
        return true;
    }

    /** Wait until the job's owner has settled it. True if it did in time or is gone already. */
    public boolean awaitSettled(String jobId, Duration timeout) {
        JobExecution execution = executions.get(jobId);
        if (execution == null) {
            return true;
        }
        try {
            return execution.awaitSettled(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public ExecutionSettings settings() {
        return settings;
    }

    private void onSettled(JobSnapshot job, JobDefinition definition) {
        executions.remove(job.id());
        if (definition.recordsBuild()) {
            builds.record(job);
        }
        meterRegistry.counter("buddy.jobs.finished",
                "type", job.type(), "status", job.status().wireName()).increment();
        if (job.completedAt() != null) {
            meterRegistry.timer("buddy.jobs.duration", "type", job.type())
                    .record(Duration.between(job.startedAt(), job.completedAt()));
        }
    }
}
