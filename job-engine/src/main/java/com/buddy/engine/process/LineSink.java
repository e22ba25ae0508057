package com.buddy.engine.process;

/**
 * Receives cleaned output lines from a supervised process.
 *
 * Called from the stdout and stderr reader threads concurrently, so
 * implementations must be thread-safe.
 */
@FunctionalInterface
public interface LineSink {

    void accept(String line);
}
