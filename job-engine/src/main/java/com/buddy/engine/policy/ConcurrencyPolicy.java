package com.buddy.engine.policy;

import com.buddy.engine.error.ActiveJobLimitException;

/**
 * Optional cap on the number of non-terminal jobs. Zero or less means no cap.
 */
public class ConcurrencyPolicy {

    private final int maxActiveJobs;

    public ConcurrencyPolicy(int maxActiveJobs) {
        this.maxActiveJobs = maxActiveJobs;
    }

    public boolean isLimited() {
        return maxActiveJobs > 0;
    }

    /**
     * @throws ActiveJobLimitException if starting one more job would exceed the cap
     */
    public void check(int activeJobs) {
        if (isLimited() && activeJobs >= maxActiveJobs) {
            throw new ActiveJobLimitException(maxActiveJobs);
        }
    }
}
