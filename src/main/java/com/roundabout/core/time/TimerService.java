package com.roundabout.core.time;

import java.time.Duration;

/**
 * Schedules one-shot tasks. Production uses {@link ScheduledExecutorTimerService};
 * tests substitute a virtual timer that fires tasks when time is advanced.
 */
public interface TimerService {

    ScheduledTask schedule(Duration delay, Runnable task);

    /**
     * Handle for a scheduled task.
     */
    @FunctionalInterface
    interface ScheduledTask {
        void cancel();
    }
}
