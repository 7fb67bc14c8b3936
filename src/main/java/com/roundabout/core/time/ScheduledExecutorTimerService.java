package com.roundabout.core.time;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerService} backed by a single daemon scheduler thread.
 */
public class ScheduledExecutorTimerService implements TimerService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorTimerService.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "roundabout-timer");
        t.setDaemon(true);
        return t;
    });

    @Override
    public ScheduledTask schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled task failed: {}", e.getMessage(), e);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
