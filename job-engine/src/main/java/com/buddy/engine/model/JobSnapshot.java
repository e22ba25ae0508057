package com.buddy.engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable, consistent view of a {@link Job} taken under the job's monitor.
 * Everything outside the owning execution reads jobs through snapshots.
 */
public record JobSnapshot(
        String              id,
        String              type,
        String              target,
        Map<String, String> params,
        JobStatus           status,
        int                 progress,
        List<String>        output,
        Instant             startedAt,
        Instant             completedAt,
        String              error,
        List<String>        diffOutput,
        String              phase
) {
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
