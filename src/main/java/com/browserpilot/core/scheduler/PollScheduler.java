package com.browserpilot.core.scheduler;

import java.time.Duration;

/**
 * Schedules repeating ticks and hands back cancelable handles.
 * <p>
 * Implementations run every tick on a single thread, so ticks never overlap
 * with each other.
 */
public interface PollScheduler {

    /**
     * Runs {@code tick} repeatedly, waiting {@code delay} between the end of
     * one run and the start of the next. The first run happens after one delay.
     *
     * @param name  label used in logs and thread diagnostics
     * @param delay fixed delay between runs
     * @param tick  work to run
     * @return the handle owning this timer
     */
    PollHandle scheduleWithFixedDelay(String name, Duration delay, Runnable tick);
}
