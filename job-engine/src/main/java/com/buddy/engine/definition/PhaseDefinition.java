package com.buddy.engine.definition;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One step of a job type: a single command run to completion.
 *
 * @param name             shown as the job's current phase
 * @param command          executable; may contain placeholders
 * @param args             arguments; may contain placeholders
 * @param workingDirectory null runs in the engine's directory; may contain placeholders
 * @param env              extra environment variables; values may contain placeholders
 * @param preview          true if the phase computes a change set that must be
 *                         approved before the following phases run
 * @param successExitCodes exit codes treated as success (CDK diff exits 1 when
 *                         it finds differences)
 * @param changePattern    preview only: a line matching it counts as a change;
 *                         null means every preview needs approval
 */
public record PhaseDefinition(
        String              name,
        String              command,
        List<String>        args,
        String              workingDirectory,
        Map<String, String> env,
        boolean             preview,
        Set<Integer>        successExitCodes,
        Pattern             changePattern) {

    public PhaseDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("phase name must not be blank");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("phase '" + name + "' has no command");
        }
        args             = args == null ? List.of() : List.copyOf(args);
        env              = env == null ? Map.of() : Map.copyOf(env);
        successExitCodes = successExitCodes == null || successExitCodes.isEmpty()
                ? Set.of(0) : Set.copyOf(successExitCodes);
    }

    public static PhaseDefinition of(String name, String command, String... args) {
        return new PhaseDefinition(name, command, List.of(args), null, Map.of(), false, null, null);
    }

    public PhaseDefinition asPreview(Pattern changePattern, Integer... successExitCodes) {
        return new PhaseDefinition(name, command, args, workingDirectory, env, true,
                Set.of(successExitCodes), changePattern);
    }

    public boolean isSuccess(int exitCode) {
        return successExitCodes.contains(exitCode);
    }

    /**
     * True unless a change pattern is configured and no line matches it.
     */
    public boolean hasChanges(List<String> lines) {
        if (changePattern == null) {
            return true;
        }
        return lines.stream().anyMatch(line -> changePattern.matcher(line).find());
    }
}
