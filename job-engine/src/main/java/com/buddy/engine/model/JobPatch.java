package com.buddy.engine.model;

import java.util.List;

/**
 * A delta applied to a {@link Job} as one atomic unit.
 *
 * Null fields are left unchanged. Lines are appended, never replace existing
 * output. Combine fields in a single patch whenever readers must not see them
 * apart (e.g. the last lines together with the terminal status).
 */
public record JobPatch(
        JobStatus    status,
        Integer      progress,
        String       error,
        String       phase,
        List<String> diffOutput,
        List<String> lines
) {
    public JobPatch {
        diffOutput = diffOutput == null ? null : List.copyOf(diffOutput);
        lines      = lines      == null ? null : List.copyOf(lines);
    }

    public static JobPatch status(JobStatus status) {
        return new JobPatch(status, null, null, null, null, null);
    }

    public static JobPatch lines(String... lines) {
        return new JobPatch(null, null, null, null, null, List.of(lines));
    }

    public JobPatch withStatus(JobStatus s)           { return new JobPatch(s, progress, error, phase, diffOutput, lines); }
    public JobPatch withProgress(int p)               { return new JobPatch(status, p, error, phase, diffOutput, lines); }
    public JobPatch withError(String e)               { return new JobPatch(status, progress, e, phase, diffOutput, lines); }
    public JobPatch withPhase(String p)               { return new JobPatch(status, progress, error, p, diffOutput, lines); }
    public JobPatch withDiffOutput(List<String> diff) { return new JobPatch(status, progress, error, phase, diff, lines); }
    public JobPatch withLines(List<String> l)         { return new JobPatch(status, progress, error, phase, diffOutput, l); }
}
