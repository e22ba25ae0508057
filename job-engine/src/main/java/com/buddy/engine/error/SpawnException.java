package com.buddy.engine.error;

import java.util.List;

/**
 * The backing command could not be started: missing executable, permission
 * denied, or a working directory that does not exist.
 */
public class SpawnException extends EngineException {

    public SpawnException(List<String> command, String reason) {
        super(Kind.SPAWN, "Failed to start " + String.join(" ", command) + ": " + reason);
    }

    public SpawnException(List<String> command, Throwable cause) {
        super(Kind.SPAWN, "Failed to start " + String.join(" ", command) + ": " + cause.getMessage(), cause);
    }
}
