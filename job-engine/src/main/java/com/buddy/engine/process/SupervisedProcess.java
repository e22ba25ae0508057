package com.buddy.engine.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on one running backing process and the two threads draining its
 * stdout and stderr.
 *
 * Termination always targets the whole process tree, since build tools
 * routinely fork workers that would otherwise outlive a cancelled job. When
 * the process leads its own session, every process left in that session is
 * included, so children orphaned by an exited root are found as well.
 */
public class SupervisedProcess implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SupervisedProcess.class);

    // Extra wait after destroyForcibly before declaring survivors.
    private static final Duration KILL_CONFIRM = Duration.ofSeconds(1);
    private static final Duration DEATH_POLL   = Duration.ofMillis(50);

    private final Process     process;
    private final ProcessSpec spec;
    private final boolean     ownSession;
    private final Duration    readerDrainTimeout;

    private Future<?> stdoutReader;
    private Future<?> stderrReader;

    private volatile boolean  detached;
    private TerminationResult termination;

    SupervisedProcess(Process process, ProcessSpec spec, boolean ownSession, Duration readerDrainTimeout) {
        this.process            = process;
        this.spec               = spec;
        this.ownSession         = ownSession;
        this.readerDrainTimeout = readerDrainTimeout;
    }

    void attachReaders(Future<?> stdoutReader, Future<?> stderrReader) {
        this.stdoutReader = stdoutReader;
        this.stderrReader = stderrReader;
    }

    public long pid()          { return process.pid(); }
    public boolean isAlive()   { return process.isAlive(); }
    public ProcessSpec spec()  { return spec; }

    /** True once the readers stopped forwarding lines to the sink. */
    boolean isDetached()       { return detached; }

    // ------------------------------------------------------------------
    // Exit
    // ------------------------------------------------------------------

    /**
     * Wait for the process to exit and for both readers to drain, so every
     * line it printed has reached the sink before the exit code is returned.
     *
     * A descendant that inherited the pipes can keep them open after the
     * root exits. Readers are given {@code readerDrainTimeout} to finish;
     * after that they are detached and anything they still read is dropped.
     */
    public int awaitExit() throws InterruptedException {
        int exitCode = process.waitFor();
        long deadline = System.nanoTime() + readerDrainTimeout.toNanos();
        boolean drained = drain(stdoutReader, deadline) & drain(stderrReader, deadline);
        if (!drained) {
            detached = true;
            log.warn("Output of pid {} still open {} ms after exit; detaching readers ({})",
                    process.pid(), readerDrainTimeout.toMillis(), spec.describe());
            closeStreams();
        }
        return exitCode;
    }

    private boolean drain(Future<?> reader, long deadlineNanos) throws InterruptedException {
        if (reader == null) {
            return true;
        }
        try {
            reader.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            log.warn("Output reader for pid {} failed: {}", process.pid(), e.getCause().getMessage());
            return true;
        }
    }

    // ------------------------------------------------------------------
    // Termination
    // ------------------------------------------------------------------

    /**
     * Tear down the process and every descendant.
     *
     * Descendants are snapshotted before any signal is sent, because once a
     * parent dies its children are re-parented and can no longer be found
     * from the root. Members of the process's own session are added to the
     * snapshot, which also covers a root that has already exited. Everything
     * gets a graceful {@code destroy()} first; what is still alive after
     * {@code grace} is killed forcibly. Pids that still cannot be confirmed
     * dead are reported as survivors.
     *
     * Runs at most once; later calls return the first result.
     */
    public synchronized TerminationResult terminate(Duration grace) {
        if (termination != null) {
            return termination;
        }
        ProcessHandle root = process.toHandle();
        Map<Long, ProcessHandle> tree = new LinkedHashMap<>();
        collect(root, tree);

        if (tree.values().stream().noneMatch(ProcessSessions::isRunning)) {
            termination = TerminationResult.ALREADY_EXITED;
            return termination;
        }

        log.info("Terminating pid {} and {} other process(es) ({})", root.pid(), tree.size() - 1, spec.describe());
        tree.values().forEach(ProcessHandle::destroy);
        awaitDeath(tree.values(), grace);

        boolean forced = false;
        if (tree.values().stream().anyMatch(ProcessSessions::isRunning)) {
            forced = true;
            // Children forked during the grace period.
            collect(root, tree);
            log.warn("pid {} ignored termination for {} ms; killing forcibly", root.pid(), grace.toMillis());
            tree.values().stream().filter(ProcessSessions::isRunning).forEach(ProcessHandle::destroyForcibly);
            awaitDeath(tree.values(), KILL_CONFIRM);
        }

        List<Long> survivors = new ArrayList<>();
        tree.values().stream().filter(ProcessSessions::isRunning).forEach(h -> survivors.add(h.pid()));
        termination = new TerminationResult(forced, List.copyOf(survivors));
        return termination;
    }

    private void collect(ProcessHandle root, Map<Long, ProcessHandle> tree) {
        root.descendants().forEach(h -> tree.putIfAbsent(h.pid(), h));
        if (ownSession) {
            ProcessSessions.members(root.pid()).forEach(h -> tree.putIfAbsent(h.pid(), h));
        }
        tree.putIfAbsent(root.pid(), root);
    }

    // Orphans are reaped by whoever inherited them, so zombies count as dead.
    private static void awaitDeath(Collection<ProcessHandle> handles, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (handles.stream().anyMatch(ProcessSessions::isRunning)) {
                if (System.nanoTime() >= deadline) {
                    log.debug("Process tree still alive after {} ms", timeout.toMillis());
                    return;
                }
                Thread.sleep(DEATH_POLL.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeStreams() {
        try {
            process.getInputStream().close();
            process.getErrorStream().close();
        } catch (IOException e) {
            log.debug("Closing output of pid {} failed: {}", process.pid(), e.getMessage());
        }
    }

    /**
     * Terminates the tree if the process is still running. With a session of
     * its own, leftovers of an exited process are swept too.
     */
    @Override
    public void close() {
        if (process.isAlive() || ownSession) {
            TerminationResult result = terminate(Duration.ZERO);
            if (!result.clean()) {
                log.warn("Orphaned process(es) {} survived {}", result.survivors(), spec.describe());
            }
        }
    }
}
