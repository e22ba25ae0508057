package com.buddy.engine.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Starts children in a session of their own and finds every process that is
 * still in it.
 *
 * A child started through {@code setsid} leads a new session whose id equals
 * its pid. Everything it forks stays in that session even after the leader
 * exits and the orphans are re-parented, so the session can still be swept
 * when the process tree no longer can. Membership is read from
 * {@code /proc/<pid>/stat}; where {@code setsid} or {@code /proc} is missing
 * sessions are unsupported and callers fall back to the process tree.
 */
final class ProcessSessions {

    private static final Logger log = LoggerFactory.getLogger(ProcessSessions.class);

    private static final Path PROC = Path.of("/proc");

    private static final String SETSID = findSetsid();

    private ProcessSessions() {}

    static boolean supported() {
        return SETSID != null;
    }

    /** {@code command} prefixed so that it starts as a session leader. */
    static List<String> wrap(List<String> command) {
        List<String> wrapped = new ArrayList<>(command.size() + 1);
        wrapped.add(SETSID);
        wrapped.addAll(command);
        return wrapped;
    }

    /**
     * Live, non-zombie processes in session {@code sid}, excluding the
     * process whose pid is {@code sid} itself.
     */
    static List<ProcessHandle> members(long sid) {
        List<ProcessHandle> members = new ArrayList<>();
        ProcessHandle.allProcesses()
                .filter(h -> h.pid() != sid)
                .forEach(h -> stat(h.pid())
                        .filter(s -> s.session() == sid && !s.zombie())
                        .ifPresent(s -> members.add(h)));
        return members;
    }

    /** False for zombies, which no signal can remove. */
    static boolean isRunning(ProcessHandle handle) {
        if (!handle.isAlive()) {
            return false;
        }
        return stat(handle.pid()).map(s -> !s.zombie()).orElse(true);
    }

    /**
     * Resolve the executable the way {@code execvp} would: names containing
     * a slash against {@code workingDirectory}, bare names along PATH.
     *
     * @return the absolute executable path, or empty if there is none
     */
    static Optional<Path> resolveExecutable(String command, Path workingDirectory, Map<String, String> env) {
        if (command.contains("/")) {
            Path path = Path.of(command);
            if (!path.isAbsolute() && workingDirectory != null) {
                path = workingDirectory.resolve(path);
            }
            return isExecutable(path) ? Optional.of(path.toAbsolutePath()) : Optional.empty();
        }
        String searchPath = env.getOrDefault("PATH", System.getenv("PATH"));
        if (searchPath == null) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(dir, command);
            if (isExecutable(candidate)) {
                return Optional.of(candidate.toAbsolutePath());
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    private static String findSetsid() {
        if (!Files.isReadable(PROC.resolve("self").resolve("stat"))) {
            return null;
        }
        Optional<Path> setsid = resolveExecutable("setsid", null, Map.of());
        if (setsid.isEmpty()) {
            log.info("setsid not found; cancellation will only reach the live process tree");
            return null;
        }
        return setsid.get().toString();
    }

    private record Stat(char state, long session) {
        boolean zombie() {
            return state == 'Z' || state == 'X';
        }
    }

    // Fields after the parenthesised command name: state ppid pgrp session ...
    private static Optional<Stat> stat(long pid) {
        try {
            String s = Files.readString(PROC.resolve(Long.toString(pid)).resolve("stat"));
            String[] fields = s.substring(s.lastIndexOf(')') + 2).split(" ");
            return Optional.of(new Stat(fields[0].charAt(0), Long.parseLong(fields[3])));
        } catch (IOException | RuntimeException e) {
            // Exited between listing and reading.
            return Optional.empty();
        }
    }
}
