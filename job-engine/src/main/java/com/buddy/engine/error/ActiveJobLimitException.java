package com.buddy.engine.error;

public class ActiveJobLimitException extends EngineException {
    public ActiveJobLimitException(int limit) {
        super(Kind.CONCURRENCY_LIMIT,
                "Active job limit reached (" + limit + "). Wait for a job to finish or cancel one.");
    }
}
