package com.buddy.engine.error;

/**
 * Raised before anything is spawned when a job would act on a protected
 * environment.
 */
public class PolicyViolationException extends EngineException {
    public PolicyViolationException(String message) {
        super(Kind.POLICY, message);
    }
}
