package com.buddy.engine.error;

import com.buddy.engine.model.JobStatus;

public class NotAwaitingApprovalException extends EngineException {
    public NotAwaitingApprovalException(String jobId, JobStatus status) {
        super(Kind.NOT_AWAITING_APPROVAL,
                "Job %s is not awaiting approval (status: %s)".formatted(jobId, status.wireName()));
    }
}
