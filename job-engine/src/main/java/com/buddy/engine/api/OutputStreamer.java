package com.buddy.engine.api;

import com.buddy.engine.stream.OutputEvent;
import com.buddy.engine.stream.OutputSubscription;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pumps an {@link OutputSubscription} into a server-sent event stream.
 *
 * Each viewer gets its own task, so a slow or vanished client only ever
 * blocks its own thread. While the job is quiet a comment line is sent every
 * {@code keepAlive} to keep proxies from closing the connection.
 */
@Component
public class OutputStreamer {

    private static final Logger log = LoggerFactory.getLogger(OutputStreamer.class);

    private final Duration        keepAlive;
    private final ExecutorService pumps;

    public OutputStreamer(@Value("${buddy.engine.stream.keep-alive:15s}") Duration keepAlive) {
        this.keepAlive = keepAlive;
        AtomicInteger counter = new AtomicInteger();
        this.pumps = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public SseEmitter stream(OutputSubscription subscription) {
        SseEmitter emitter = new SseEmitter(0L);
        AtomicBoolean gone = new AtomicBoolean();
        emitter.onCompletion(() -> gone.set(true));
        emitter.onTimeout(() -> gone.set(true));
        emitter.onError(e -> gone.set(true));
        pumps.submit(() -> pump(subscription, emitter, gone));
        return emitter;
    }

    private void pump(OutputSubscription subscription, SseEmitter emitter, AtomicBoolean gone) {
        try (subscription) {
            while (!gone.get()) {
                Optional<OutputEvent> event = subscription.next(keepAlive);
                if (event.isPresent()) {
                    emitter.send(SseEmitter.event().data(event.get(), MediaType.APPLICATION_JSON));
                } else if (!subscription.isFinished()) {
                    emitter.send(SseEmitter.event().comment("keep-alive"));
                }
                if (subscription.isFinished()) {
                    emitter.complete();
                    return;
                }
            }
        } catch (IOException | IllegalStateException e) {
            // Client went away; the subscription is closed by try-with-resources.
            log.debug("Viewer of job {} disconnected: {}", subscription.jobId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        }
    }

    @PreDestroy
    public void shutdown() {
        pumps.shutdownNow();
    }
}
