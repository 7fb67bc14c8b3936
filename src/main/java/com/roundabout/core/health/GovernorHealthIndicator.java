package com.roundabout.core.health;

import com.roundabout.core.governor.CircuitBreakerStatus;
import com.roundabout.core.governor.ResourceGovernor;
import com.roundabout.core.governor.SystemMetrics;
import com.roundabout.core.governor.SystemTempo;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the resource governor.
 * <p>
 * DOWN while the breaker is open or the system sleeps, DEGRADED while the
 * breaker probes or the tempo is reduced, UP otherwise.
 */
@Component("governorHealthIndicator")
public class GovernorHealthIndicator implements HealthIndicator {

    private final ResourceGovernor governor;

    public GovernorHealthIndicator(ResourceGovernor governor) {
        this.governor = governor;
    }

    @Override
    public Health health() {
        SystemMetrics metrics = governor.getSystemMetrics();
        CircuitBreakerStatus breaker = metrics.circuitBreakerInfo().status();
        SystemTempo tempo = metrics.systemTempo();

        var builder = Health.up()
                .withDetail("circuitBreaker", breaker.name())
                .withDetail("tempo", tempo.label())
                .withDetail("activeAgents", metrics.activeAgents())
                .withDetail("errorRate", metrics.circuitBreakerInfo().errorRate())
                .withDetail("pausedHierarchies", metrics.pausedHierarchies().size());

        if (breaker == CircuitBreakerStatus.OPEN || tempo == SystemTempo.SLEEP) {
            return builder.down().build();
        }
        if (breaker == CircuitBreakerStatus.HALF_OPEN || tempo == SystemTempo.LOW_INTENSITY) {
            return builder.status("DEGRADED").build();
        }
        return builder.build();
    }
}
