package com.roundabout.core.agent;

import java.math.BigDecimal;

/**
 * Binary PROCEED / HALT decision taken in ADAPT. Rules are evaluated in
 * order and the first match halts the agent.
 */
public class StrategicDecisionPolicy {

    private final double haltElapsedFraction;

    public StrategicDecisionPolicy(double haltElapsedFraction) {
        this.haltElapsedFraction = haltElapsedFraction;
    }

    public StrategicDecision decide(DecisionFactors factors) {
        if (!factors.resourcesAvailable()) {
            return halt("Insufficient resources remaining", factors);
        }
        if (factors.failureCount() >= 3 && factors.failureSeverity() == FailureSeverity.CRITICAL) {
            return halt("Multiple critical failures detected", factors);
        }
        if (factors.recursionDepth() >= factors.maxRecursionDepth() - 1) {
            return halt("Near maximum recursion depth", factors);
        }
        BigDecimal limit = BigDecimal.valueOf(factors.maxExecutionTimeMs())
                .multiply(BigDecimal.valueOf(haltElapsedFraction));
        if (BigDecimal.valueOf(factors.timeElapsed().toMillis()).compareTo(limit) > 0) {
            return halt("Approaching execution time limit", factors);
        }
        return new StrategicDecision(StrategicDecision.Decision.PROCEED,
                "Failure is recoverable with new approach", factors);
    }

    private static StrategicDecision halt(String reason, DecisionFactors factors) {
        return new StrategicDecision(StrategicDecision.Decision.HALT_AND_REPORT_FAILURE, reason, factors);
    }
}
