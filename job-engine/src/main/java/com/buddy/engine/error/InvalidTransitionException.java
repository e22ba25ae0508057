package com.buddy.engine.error;

import com.buddy.engine.model.JobStatus;

/**
 * A patch tried to move a job along an edge the state machine does not have,
 * or to write to a job that is already terminal. The job is left untouched.
 */
public class InvalidTransitionException extends EngineException {

    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(Kind.INVALID_TRANSITION,
                "Job %s cannot move from %s to %s".formatted(jobId, from.wireName(), to.wireName()));
        this.from = from;
        this.to   = to;
    }

    public JobStatus getFrom() { return from; }
    public JobStatus getTo()   { return to; }
}
