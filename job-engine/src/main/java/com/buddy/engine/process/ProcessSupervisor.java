package com.buddy.engine.process;

import com.buddy.engine.error.SpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts backing processes and pumps their output into a {@link LineSink}.
 *
 * Each process gets two reader tasks (stdout and stderr) on a cached pool of
 * daemon threads. Lines are forwarded as soon as they are read, with terminal
 * escape sequences removed and blank lines dropped. Colour output is switched
 * off through {@code NO_COLOR} / {@code FORCE_COLOR} for every child.
 * Where the platform allows it every child leads its own session, see
 * {@link ProcessSessions}.
 */
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final ExecutorService readers;
    private final Duration        readerDrainTimeout;

    public ProcessSupervisor(Duration readerDrainTimeout) {
        this.readerDrainTimeout = readerDrainTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.readers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-output-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start {@code spec} and begin streaming its output to {@code sink}.
     *
     * @throws SpawnException if the working directory is missing or the
     *         command cannot be executed
     */
    public SupervisedProcess spawn(ProcessSpec spec, LineSink sink) {
        if (spec.workingDirectory() != null && !Files.isDirectory(spec.workingDirectory())) {
            throw new SpawnException(spec.command(),
                    "working directory does not exist: " + spec.workingDirectory());
        }
        boolean ownSession = ProcessSessions.supported();
        List<String> command = spec.command();
        if (ownSession) {
            // setsid reports a missing executable only through its exit code.
            Path executable = ProcessSessions.resolveExecutable(command.get(0), spec.workingDirectory(), spec.environment())
                    .orElseThrow(() -> new SpawnException(spec.command(), "no such executable"));
            List<String> resolved = new ArrayList<>(command);
            resolved.set(0, executable.toString());
            command = ProcessSessions.wrap(resolved);
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        if (spec.workingDirectory() != null) {
            builder.directory(spec.workingDirectory().toFile());
        }
        builder.environment().putAll(spec.environment());
        builder.environment().put("NO_COLOR", "1");
        builder.environment().put("FORCE_COLOR", "0");

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new SpawnException(spec.command(), e);
        }
        log.debug("Started pid {}: {}", process.pid(), spec.describe());

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }

        SupervisedProcess handle = new SupervisedProcess(process, spec, ownSession, readerDrainTimeout);
        Future<?> out = readers.submit(() -> pump(process.getInputStream(), handle, sink));
        Future<?> err = readers.submit(() -> pump(process.getErrorStream(), handle, sink));
        handle.attachReaders(out, err);
        return handle;
    }

    private static void pump(InputStream stream, SupervisedProcess handle, LineSink sink) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String raw;
            while ((raw = reader.readLine()) != null) {
                if (handle.isDetached()) {
                    return;
                }
                String line = AnsiStripper.strip(raw);
                if (line.isBlank()) {
                    continue;
                }
                try {
                    sink.accept(line);
                } catch (RuntimeException e) {
                    // Keep reading so the child never blocks on a full pipe.
                    log.warn("Output sink for pid {} rejected a line: {}", handle.pid(), e.getMessage());
                }
            }
        } catch (IOException e) {
            if (!handle.isDetached()) {
                log.debug("Output stream of pid {} closed: {}", handle.pid(), e.getMessage());
            }
        }
    }

    /** Invoked by the container on shutdown; abandons reader threads. */
    public void shutdown() {
        readers.shutdownNow();
    }
}
