package com.buddy.engine.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved command line for one backing process.
 *
 * @param command          executable followed by its arguments
 * @param workingDirectory directory to start in; null inherits the engine's
 * @param environment      variables added on top of the engine's environment
 */
public record ProcessSpec(List<String> command, Path workingDirectory, Map<String, String> environment) {

    public ProcessSpec {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command     = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static ProcessSpec of(String... command) {
        return new ProcessSpec(List.of(command), null, Map.of());
    }

    public String describe() {
        return String.join(" ", command);
    }
}
