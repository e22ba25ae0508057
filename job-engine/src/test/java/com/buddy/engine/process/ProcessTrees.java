package com.buddy.engine.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Test helper: liveness check that treats zombies as dead. */
public final class ProcessTrees {

    private ProcessTrees() {}

    public static boolean isRunning(long pid) {
        if (ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false)) {
            Path stat = Path.of("/proc", Long.toString(pid), "stat");
            if (!Files.exists(stat)) {
                return true;
            }
            try {
                String s = Files.readString(stat);
                // Field 3, after the parenthesised command name.
                char state = s.substring(s.lastIndexOf(')') + 2).charAt(0);
                return state != 'Z' && state != 'X';
            } catch (IOException | RuntimeException e) {
                return false;
            }
        }
        return false;
    }
}
