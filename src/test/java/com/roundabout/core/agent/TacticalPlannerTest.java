package com.roundabout.core.agent;

import com.roundabout.core.model.CognitivePhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TacticalPlannerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private static StrategicDecision proceed() {
        return new StrategicDecision(StrategicDecision.Decision.PROCEED, "Failure is recoverable with new approach",
                new DecisionFactors(true, 1, FailureSeverity.MINOR, FailureType.LOGIC, 0, 5, Duration.ZERO, 30_000));
    }

    private static FailureRecord failure(String error) {
        return new FailureRecord(CognitivePhase.EMERGE, error, NOW);
    }

    @Test
    @DisplayName("resource failures get a resource-optimized plan")
    void resourceApproach() {
        TacticalPlan plan = TacticalPlanner.synthesize(proceed(),
                List.of(failure("Core task execution failed"), failure("resource exhausted")), NOW);

        assertEquals(TacticalPlan.RESOURCE_OPTIMIZED, plan.approach());
        assertEquals(0.6, plan.confidence(), 1e-9);
        assertEquals(NOW, plan.createdAt());
        assertNotNull(plan.id());
    }

    @Test
    @DisplayName("logic or execution failures get an alternative-logic plan")
    void logicApproach() {
        TacticalPlan plan = TacticalPlanner.synthesize(proceed(), List.of(failure("Core task execution failed")), NOW);

        assertEquals(TacticalPlan.ALTERNATIVE_LOGIC, plan.approach());
        assertEquals(0.6, plan.confidence(), 1e-9);
    }

    @Test
    @DisplayName("anything else is retried conservatively")
    void conservativeApproach() {
        TacticalPlan plan = TacticalPlanner.synthesize(proceed(), List.of(), NOW);

        assertEquals(TacticalPlan.CONSERVATIVE_RETRY, plan.approach());
        assertEquals(0.7, plan.confidence(), 1e-9);
    }

    @Test
    @DisplayName("confidence is clamped to [0.1, 0.9]")
    void confidenceClamp() {
        assertEquals(0.1, TacticalPlanner.confidence(TacticalPlan.CONSERVATIVE_RETRY, 10), 1e-9);
        assertEquals(0.8, TacticalPlanner.confidence(TacticalPlan.RESOURCE_OPTIMIZED, 0), 1e-9);
        assertEquals(0.9, TacticalPlanner.clamp(1.4), 1e-9);
    }

    @Test
    @DisplayName("planning without a PROCEED decision is rejected")
    void missingContext() {
        assertThrows(TacticalPlanInvalidException.class, () -> TacticalPlanner.synthesize(null, List.of(), NOW));

        var halt = new StrategicDecision(StrategicDecision.Decision.HALT_AND_REPORT_FAILURE, "stop",
                proceed().context());
        assertThrows(TacticalPlanInvalidException.class, () -> TacticalPlanner.synthesize(halt, List.of(), NOW));
    }
}
