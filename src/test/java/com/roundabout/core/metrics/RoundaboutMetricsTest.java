package com.roundabout.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoundaboutMetricsTest {

    private SimpleMeterRegistry registry;
    private RoundaboutMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RoundaboutMetrics(registry);
    }

    @Test
    @DisplayName("recordApproval tags operation, result and denial reason")
    void recordApproval() {
        metrics.recordApproval("clone_agent", true, null);
        metrics.recordApproval("clone_agent", false, "BUDGET_INSUFFICIENT");
        metrics.recordApproval("clone_agent", false, "BUDGET_INSUFFICIENT");

        var granted = registry.find("roundabout.governor.approvals")
                .tag("result", "granted").tag("reason", "none").counter();
        var denied = registry.find("roundabout.governor.approvals")
                .tag("result", "denied").tag("reason", "BUDGET_INSUFFICIENT").counter();

        assertNotNull(granted);
        assertNotNull(denied);
        assertEquals(1.0, granted.count());
        assertEquals(2.0, denied.count());
    }

    @Test
    @DisplayName("recordPhase creates a timer per phase and outcome")
    void recordPhase() {
        metrics.recordPhase("EMERGE", true, 12);
        metrics.recordPhase("EMERGE", false, 3);

        var success = registry.find("roundabout.loop.phase.duration").tag("success", "true").timer();
        assertNotNull(success);
        assertEquals(1, success.count());
    }

    @Test
    @DisplayName("breaker transitions are counted by edge")
    void recordBreakerTransition() {
        metrics.recordBreakerTransition("CLOSED", "OPEN");

        var counter = registry.find("roundabout.breaker.transitions")
                .tag("from", "CLOSED").tag("to", "OPEN").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("child budgets are recorded as a distribution")
    void recordChildBudget() {
        metrics.recordChildBudget(3);
        metrics.recordChildBudget(1);

        var summary = registry.find("roundabout.clone.child_budget_llm_calls").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(4.0, summary.totalAmount());
    }

    @Test
    @DisplayName("lifecycle, decisions, tempo, errors and fallbacks increment their counters")
    void counters() {
        metrics.recordAgentLifecycle("cloned", "CORE");
        metrics.recordStrategicDecision("PROCEED");
        metrics.recordTempoChange("Sleep");
        metrics.recordErrorReported();
        metrics.recordModelFallback("timeout");

        assertEquals(1.0, registry.get("roundabout.agents.lifecycle").tag("event", "cloned").counter().count());
        assertEquals(1.0, registry.get("roundabout.adapt.decisions").tag("decision", "PROCEED").counter().count());
        assertEquals(1.0, registry.get("roundabout.tempo.changes").tag("tempo", "Sleep").counter().count());
        assertEquals(1.0, registry.get("roundabout.governor.errors").counter().count());
        assertEquals(1.0, registry.get("roundabout.emerge.model_fallbacks").tag("cause", "timeout").counter().count());
    }
}
