package com.buddy.engine.stream;

import com.buddy.engine.model.Job;
import com.buddy.engine.model.JobStatus;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * A single viewer's position in a job's output.
 *
 * Yields every line from the start of the job in order, then exactly one
 * done event once the job is terminal, then nothing. Not thread-safe: one
 * subscription belongs to one consumer.
 */
public class OutputSubscription implements AutoCloseable {

    private final Job               job;
    private final Runnable          onClose;
    private final Deque<OutputEvent> pending = new ArrayDeque<>();

    private int     cursor;
    private boolean doneQueued;
    private boolean finished;
    private boolean closed;

    OutputSubscription(Job job, Runnable onClose) {
        this.job     = job;
        this.onClose = onClose;
    }

    public String jobId() {
        return job.getId();
    }

    /**
     * Next event, waiting up to {@code timeout} for one to appear.
     *
     * @return empty if nothing arrived in time, or once the stream is over
     */
    public Optional<OutputEvent> next(Duration timeout) throws InterruptedException {
        if (finished || closed) {
            return Optional.empty();
        }
        if (pending.isEmpty() && !doneQueued) {
            Job.OutputView view = job.awaitOutput(cursor, timeout.toMillis());
            cursor += view.lines().size();
            view.lines().forEach(line -> pending.add(OutputEvent.line(line)));
            if (view.status().isTerminal()) {
                pending.add(OutputEvent.done(view.status()));
                doneQueued = true;
            }
        }
        OutputEvent event = pending.poll();
        if (event != null && event.endOfStream()) {
            finished = true;
        }
        return Optional.ofNullable(event);
    }

    /** True once the done event has been handed out. */
    public boolean isFinished() {
        return finished;
    }

    /** Status the stream ended with, or null while still open. */
    public JobStatus finalStatus() {
        return finished ? job.getStatus() : null;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose.run();
        }
    }
}
