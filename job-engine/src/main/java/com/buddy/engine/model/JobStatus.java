package com.buddy.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a supervised Job.
 *
 * Transitions:
 *   PENDING           → RUNNING | FAILED | CANCELLED
 *   RUNNING           → AWAITING_APPROVAL | COMPLETED | FAILED | CANCELLED
 *   AWAITING_APPROVAL → RUNNING (approved) | CANCELLED (rejected or cancelled)
 *
 * COMPLETED, FAILED and CANCELLED are terminal: nothing leaves them.
 * On the wire the states are lower-case ("awaiting_approval").
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    AWAITING_APPROVAL,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING           -> next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING           -> next == AWAITING_APPROVAL || next == COMPLETED
                                   || next == FAILED || next == CANCELLED;
            case AWAITING_APPROVAL -> next == RUNNING || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
