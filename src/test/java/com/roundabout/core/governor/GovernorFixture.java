package com.roundabout.core.governor;

import com.roundabout.core.events.EventBus;
import com.roundabout.core.metrics.RoundaboutMetrics;
import com.roundabout.core.time.ManualTime;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Wires a real governor over a {@link ManualTime} for tests in any package.
 */
public final class GovernorFixture {

    public final ManualTime time;
    public final GovernorProperties properties;
    public final EventBus eventBus;
    public final SimpleMeterRegistry registry;
    public final RoundaboutMetrics metrics;
    public final ResourceLedger ledger;
    public final CircuitBreaker breaker;
    public final SystemTempoController tempo;
    public final ResourceGovernor governor;

    public GovernorFixture() {
        this(new GovernorProperties());
    }

    public GovernorFixture(GovernorProperties properties) {
        this.time = new ManualTime();
        this.properties = properties;
        this.eventBus = new EventBus();
        this.registry = new SimpleMeterRegistry();
        this.metrics = new RoundaboutMetrics(registry);
        this.ledger = new ResourceLedger();
        this.breaker = new CircuitBreaker(properties, time, time, eventBus, metrics);
        this.tempo = new SystemTempoController(properties, time, eventBus, metrics);
        this.governor = new ResourceGovernor(properties, ledger, breaker, tempo, eventBus, metrics, time);
    }
}
