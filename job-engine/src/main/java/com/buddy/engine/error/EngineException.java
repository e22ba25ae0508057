package com.buddy.engine.error;

/**
 * Base type for every failure the engine reports to its callers.
 *
 * Unchecked, like the rest of the control plane: callers only catch it when
 * they have a specific recovery. The {@link Kind} decides how the HTTP layer
 * renders it, so new subclasses need no handler changes.
 */
public class EngineException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        UNKNOWN_TYPE,
        INVALID_TRANSITION,
        NOT_AWAITING_APPROVAL,
        ALREADY_RESPONDED,
        POLICY,
        CONCURRENCY_LIMIT,
        SPAWN
    }

    private final Kind kind;

    public EngineException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EngineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
