package com.roundabout.core.governor;

import com.roundabout.core.events.AgentEvent;
import com.roundabout.core.events.EventBus;
import com.roundabout.core.metrics.RoundaboutMetrics;
import com.roundabout.core.time.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Process-wide tri-state breaker.
 * <p>
 * CLOSED opens when a threshold is breached; OPEN moves to HALF_OPEN when the
 * cooldown scheduled on the {@link TimerService} fires; HALF_OPEN closes after
 * a configured number of consecutive approved requests and re-opens on any
 * error. Every transition happens under one lock.
 */
@Component
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final Object lock = new Object();
    private final GovernorProperties.Breaker config;
    private final Clock clock;
    private final TimerService timer;
    private final EventBus eventBus;
    private final RoundaboutMetrics metrics;

    private CircuitBreakerStatus status = CircuitBreakerStatus.CLOSED;
    private Instant lastTriggered;
    private Instant nextRetryAt;
    private int halfOpenSuccesses;
    private long generation;
    private TimerService.ScheduledTask cooldown;

    public CircuitBreaker(GovernorProperties properties, Clock clock, TimerService timer,
                          EventBus eventBus, RoundaboutMetrics metrics) {
        this.config = properties.getCircuitBreaker();
        this.clock = clock;
        this.timer = timer;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Opens the breaker unless it is already open.
     *
     * @return true only for the caller that performed the transition
     */
    public boolean tryOpen(String reason) {
        CircuitBreakerStatus previous;
        synchronized (lock) {
            if (status == CircuitBreakerStatus.OPEN) {
                return false;
            }
            previous = status;
            openLocked();
        }
        log.warn("Circuit breaker opened: {}", reason);
        announce(previous, CircuitBreakerStatus.OPEN, reason);
        return true;
    }

    /**
     * Counts an approved request. Closes the breaker once enough consecutive
     * approvals have been seen while half-open.
     */
    public void recordProbeSuccess() {
        boolean closed = false;
        synchronized (lock) {
            if (status != CircuitBreakerStatus.HALF_OPEN) {
                return;
            }
            halfOpenSuccesses++;
            if (halfOpenSuccesses >= config.getHalfOpenSuccessThreshold()) {
                status = CircuitBreakerStatus.CLOSED;
                halfOpenSuccesses = 0;
                nextRetryAt = null;
                closed = true;
            }
        }
        if (closed) {
            log.info("Circuit breaker closed after {} successful probes", config.getHalfOpenSuccessThreshold());
            announce(CircuitBreakerStatus.HALF_OPEN, CircuitBreakerStatus.CLOSED, "probes succeeded");
        }
    }

    /**
     * Operator override. Forcing OPEN restarts the cooldown; forcing any other
     * state cancels a pending cooldown.
     */
    public void force(CircuitBreakerStatus target) {
        CircuitBreakerStatus previous;
        synchronized (lock) {
            previous = status;
            if (target == CircuitBreakerStatus.OPEN) {
                openLocked();
            } else {
                cancelCooldownLocked();
                status = target;
                halfOpenSuccesses = 0;
                nextRetryAt = null;
            }
        }
        if (previous != target) {
            log.info("Circuit breaker forced from {} to {}", previous, target);
            announce(previous, target, "manual override");
        }
    }

    public CircuitBreakerStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    public CircuitBreakerInfo info(double errorRate, double costSpike) {
        synchronized (lock) {
            return new CircuitBreakerInfo(status, errorRate, costSpike, lastTriggered, nextRetryAt);
        }
    }

    private void openLocked() {
        cancelCooldownLocked();
        Instant now = clock.instant();
        Duration window = config.getTimeWindow();
        status = CircuitBreakerStatus.OPEN;
        halfOpenSuccesses = 0;
        lastTriggered = now;
        nextRetryAt = now.plus(window);
        long scheduledGeneration = ++generation;
        cooldown = timer.schedule(window, () -> onCooldownElapsed(scheduledGeneration));
    }

    private void onCooldownElapsed(long scheduledGeneration) {
        synchronized (lock) {
            if (scheduledGeneration != generation || status != CircuitBreakerStatus.OPEN) {
                return;
            }
            status = CircuitBreakerStatus.HALF_OPEN;
            halfOpenSuccesses = 0;
            cooldown = null;
        }
        log.info("Circuit breaker moved to half-open state");
        announce(CircuitBreakerStatus.OPEN, CircuitBreakerStatus.HALF_OPEN, "cooldown elapsed");
    }

    private void cancelCooldownLocked() {
        if (cooldown != null) {
            cooldown.cancel();
            cooldown = null;
        }
        generation++;
    }

    private void announce(CircuitBreakerStatus from, CircuitBreakerStatus to, String reason) {
        metrics.recordBreakerTransition(from.name(), to.name());
        eventBus.publish(new AgentEvent("governor.breaker." + to.name().toLowerCase(), null,
                Map.of("from", from.name(), "reason", reason), clock.instant()));
    }
}
