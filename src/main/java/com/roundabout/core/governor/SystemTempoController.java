package com.roundabout.core.governor;

import com.roundabout.core.events.AgentEvent;
import com.roundabout.core.events.EventBus;
import com.roundabout.core.metrics.RoundaboutMetrics;
import com.roundabout.core.model.ResourceUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Derives the system tempo from error-rate and cost-spike signals.
 * <p>
 * Degrades one level when either signal crosses its degrade threshold and
 * recovers one level only when both are under their recovery thresholds.
 * A single observation moves the tempo at most one level.
 */
@Component
public class SystemTempoController {

    private static final Logger log = LoggerFactory.getLogger(SystemTempoController.class);

    static final ResourceUsage SLEEP_MINIMAL_COST = new ResourceUsage(1, 1, 1024, 1000);

    private final GovernorProperties.Tempo thresholds;
    private final Clock clock;
    private final EventBus eventBus;
    private final RoundaboutMetrics metrics;

    private SystemTempo tempo = SystemTempo.HIGH_PERFORMANCE;

    public SystemTempoController(GovernorProperties properties, Clock clock,
                                 EventBus eventBus, RoundaboutMetrics metrics) {
        this.thresholds = properties.getTempo();
        this.clock = clock;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public synchronized SystemTempo current() {
        return tempo;
    }

    /**
     * Feeds the current signals through the hysteresis ladder.
     *
     * @return the tempo after the observation
     */
    public SystemTempo observe(double errorRate, double costSpike) {
        SystemTempo previous;
        SystemTempo next;
        synchronized (this) {
            previous = tempo;
            next = switch (tempo) {
                case HIGH_PERFORMANCE -> errorRate > thresholds.getErrorDegradeToLowIntensity()
                        || costSpike > thresholds.getCostDegradeToLowIntensity()
                        ? SystemTempo.LOW_INTENSITY : SystemTempo.HIGH_PERFORMANCE;
                case LOW_INTENSITY -> {
                    if (errorRate > thresholds.getErrorDegradeToSleep()
                            || costSpike > thresholds.getCostDegradeToSleep()) {
                        yield SystemTempo.SLEEP;
                    }
                    if (errorRate < thresholds.getErrorRecoverToHighPerformance()
                            && costSpike < thresholds.getCostRecoverToHighPerformance()) {
                        yield SystemTempo.HIGH_PERFORMANCE;
                    }
                    yield SystemTempo.LOW_INTENSITY;
                }
                case SLEEP -> errorRate < thresholds.getErrorRecoverToLowIntensity()
                        && costSpike < thresholds.getCostRecoverToLowIntensity()
                        ? SystemTempo.LOW_INTENSITY : SystemTempo.SLEEP;
            };
            tempo = next;
        }
        if (next != previous) {
            announce(previous, next, String.format("errorRate=%.3f costSpike=%.3f", errorRate, costSpike));
        }
        return next;
    }

    /**
     * Manual override; the next observation resumes automatic adjustment from here.
     */
    public void set(SystemTempo target) {
        SystemTempo previous;
        synchronized (this) {
            previous = tempo;
            tempo = target;
        }
        if (previous != target) {
            announce(previous, target, "manual override");
        }
    }

    /**
     * Scales an estimate for the given tempo. Low-Intensity halves LLM and
     * compute (rounding up); Sleep clamps non-memory operations to a minimal cost.
     */
    public static ResourceUsage adjust(SystemTempo tempo, OperationType operation, ResourceUsage estimate) {
        return switch (tempo) {
            case HIGH_PERFORMANCE -> estimate;
            case LOW_INTENSITY -> new ResourceUsage(halfUp(estimate.llmCalls()), halfUp(estimate.computeUnits()),
                    estimate.storageBytes(), estimate.executionTimeMs());
            case SLEEP -> operation == OperationType.MEMORY_ACCESS ? estimate : SLEEP_MINIMAL_COST;
        };
    }

    private static long halfUp(long value) {
        return value / 2 + value % 2;
    }

    private void announce(SystemTempo from, SystemTempo to, String reason) {
        log.info("System tempo changed from {} to {} ({})", from.label(), to.label(), reason);
        metrics.recordTempoChange(to.name());
        eventBus.publish(new AgentEvent("governor.tempo.changed", null,
                Map.of("from", from.label(), "to", to.label(), "reason", reason), clock.instant()));
    }
}
