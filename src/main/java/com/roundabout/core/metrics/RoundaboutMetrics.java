package com.roundabout.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent execution and resource governance.
 */
@Service
public class RoundaboutMetrics {

    private final MeterRegistry registry;

    public RoundaboutMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordApproval(String operation, boolean approved, String denialReason) {
        Counter.builder("roundabout.governor.approvals")
                .tag("operation", operation)
                .tag("result", approved ? "granted" : "denied")
                .tag("reason", denialReason == null ? "none" : denialReason)
                .register(registry)
                .increment();
    }

    public void recordBreakerTransition(String from, String to) {
        Counter.builder("roundabout.breaker.transitions")
                .description("Circuit breaker state transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordTempoChange(String tempo) {
        Counter.builder("roundabout.tempo.changes")
                .tag("tempo", tempo)
                .register(registry)
                .increment();
    }

    public void recordErrorReported() {
        Counter.builder("roundabout.governor.errors")
                .description("Errors reported to the governor")
                .register(registry)
                .increment();
    }

    public void recordPhase(String phase, boolean success, long ms) {
        Timer.builder("roundabout.loop.phase.duration")
                .tag("phase", phase)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStrategicDecision(String decision) {
        Counter.builder("roundabout.adapt.decisions")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    /**
     * @param event "created", "cloned" or "terminated"
     */
    public void recordAgentLifecycle(String event, String role) {
        Counter.builder("roundabout.agents.lifecycle")
                .tag("event", event)
                .tag("role", role)
                .register(registry)
                .increment();
    }

    /**
     * Records the LLM-call dimension of a budget handed to a new child.
     */
    public void recordChildBudget(long llmCalls) {
        DistributionSummary.builder("roundabout.clone.child_budget_llm_calls")
                .description("LLM-call budget allotted to cloned agents")
                .register(registry)
                .record(llmCalls);
    }

    public void recordModelFallback(String cause) {
        Counter.builder("roundabout.emerge.model_fallbacks")
                .description("Coordinator model calls that fell back to the local heuristic")
                .tag("cause", cause)
                .register(registry)
                .increment();
    }
}
