package com.browserpilot.core.scheduler;

/**
 * Owned handle of a repeating timer. Whoever holds the handle in committed
 * state is responsible for it; cancelling is idempotent.
 */
public interface PollHandle {

    /** Stops future ticks. A tick already running is allowed to finish. */
    void cancel();

    boolean isCancelled();
}
