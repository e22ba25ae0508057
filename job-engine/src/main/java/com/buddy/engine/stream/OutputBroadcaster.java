package com.buddy.engine.stream;

import com.buddy.engine.error.JobNotFoundException;
import com.buddy.engine.model.Job;
import com.buddy.engine.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out independent cursors over a job's output.
 *
 * Appends go straight into the job's own output list and wake waiting
 * subscribers through the job monitor, so a slow viewer never holds up the
 * process that produces the lines, and every viewer sees the same order.
 */
@Component
public class OutputBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(OutputBroadcaster.class);

    private final JobStore      store;
    private final AtomicInteger open = new AtomicInteger();

    public OutputBroadcaster(JobStore store) {
        this.store = store;
    }

    /**
     * Subscribe from line 0. Works for archived jobs too, which replay their
     * stored output and finish immediately.
     *
     * @throws JobNotFoundException if the job is unknown
     */
    public OutputSubscription subscribe(String jobId) {
        Job job = store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        int count = open.incrementAndGet();
        log.debug("Viewer attached to job {} ({} open)", jobId, count);
        return new OutputSubscription(job, () -> {
            int left = open.decrementAndGet();
            log.debug("Viewer detached from job {} ({} open)", jobId, left);
        });
    }

    public int openSubscriptions() {
        return open.get();
    }
}
