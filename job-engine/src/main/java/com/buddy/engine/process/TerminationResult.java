package com.buddy.engine.process;

import java.util.List;

/**
 * Outcome of tearing down a process tree.
 *
 * @param forced    true if the grace period ran out and the tree was killed
 * @param survivors pids that could not be confirmed dead afterwards
 */
public record TerminationResult(boolean forced, List<Long> survivors) {

    public static final TerminationResult ALREADY_EXITED = new TerminationResult(false, List.of());

    public boolean clean() {
        return survivors.isEmpty();
    }
}
