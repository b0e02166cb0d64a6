package com.browserpilot.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PollScheduler} backed by one single-threaded {@link ScheduledExecutorService}.
 * Every timer of the client (session status, command polling) shares this
 * thread, so continuations are applied in completion order.
 */
public class EventLoopScheduler implements PollScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLoopScheduler.class);

    private final ScheduledExecutorService executor;

    public EventLoopScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "browserpilot-event-loop");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public PollHandle scheduleWithFixedDelay(String name, Duration delay, Runnable tick) {
        var handle = new FutureHandle(name);
        long millis = Math.max(1, delay.toMillis());
        handle.future = executor.scheduleWithFixedDelay(() -> {
            if (handle.isCancelled()) return;
            try {
                tick.run();
            } catch (RuntimeException e) {
                // an escaped exception cancels the timer
                log.error("Timer '{}' tick failed: {}", name, e.getMessage(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Scheduled timer '{}' every {}ms", name, millis);
        return handle;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event loop did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class FutureHandle implements PollHandle {

        private final String name;
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private volatile ScheduledFuture<?> future;

        private FutureHandle(String name) {
            this.name = name;
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                ScheduledFuture<?> f = future;
                if (f != null) {
                    f.cancel(false);
                }
                log.debug("Cancelled timer '{}'", name);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }

        @Override
        public String toString() {
            return "PollHandle[" + name + (cancelled.get() ? ", cancelled" : "") + "]";
        }
    }
}
