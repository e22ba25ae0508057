package com.buddy.engine.error;

public class AlreadyRespondedException extends EngineException {
    public AlreadyRespondedException(String jobId) {
        super(Kind.ALREADY_RESPONDED, "Approval for job " + jobId + " has already been decided");
    }
}
