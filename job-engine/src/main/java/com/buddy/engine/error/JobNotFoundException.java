package com.buddy.engine.error;

public class JobNotFoundException extends EngineException {
    public JobNotFoundException(String jobId) {
        super(Kind.NOT_FOUND, "Job not found: " + jobId);
    }
}
