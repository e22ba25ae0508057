package com.buddy.engine.approval;

/** How a checkpoint was resolved. Only APPROVED lets the apply phase run. */
public enum ApprovalDecision {
    APPROVED,
    REJECTED,
    CANCELLED,
    TIMED_OUT;

    public static ApprovalDecision of(boolean approved) {
        return approved ? APPROVED : REJECTED;
    }
}
