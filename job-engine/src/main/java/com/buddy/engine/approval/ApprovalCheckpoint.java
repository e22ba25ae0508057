package com.buddy.engine.approval;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One pending yes/no question for a job. The first decision wins; every
 * later attempt to decide is refused.
 */
public final class ApprovalCheckpoint {

    private final String                              jobId;
    private final Instant                             openedAt = Instant.now();
    private final CompletableFuture<ApprovalDecision> decision = new CompletableFuture<>();

    ApprovalCheckpoint(String jobId) {
        this.jobId = jobId;
    }

    public String jobId()      { return jobId; }
    public Instant openedAt()  { return openedAt; }

    /** Record {@code d} unless a decision already exists. */
    boolean decide(ApprovalDecision d) {
        return decision.complete(d);
    }

    public boolean isDecided() {
        return decision.isDone();
    }

    public Optional<ApprovalDecision> decision() {
        return Optional.ofNullable(decision.getNow(null));
    }

    CompletableFuture<ApprovalDecision> future() {
        return decision;
    }
}
