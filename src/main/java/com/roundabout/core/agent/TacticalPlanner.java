package com.roundabout.core.agent;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Synthesizes a new {@link TacticalPlan} from the adaptation context and the
 * failures that led to it.
 */
public final class TacticalPlanner {

    private TacticalPlanner() {}

    /**
     * @throws TacticalPlanInvalidException when no adaptation context is available,
     *         i.e. INTEGRATE was entered without a PROCEED decision
     */
    public static TacticalPlan synthesize(StrategicDecision adaptationContext, List<FailureRecord> failures,
                                          Instant now) {
        if (adaptationContext == null || !adaptationContext.proceed()) {
            throw new TacticalPlanInvalidException("No adaptation context to plan from");
        }
        String approach = chooseApproach(failures);
        return new TacticalPlan(UUID.randomUUID().toString(), approach, confidence(approach, failures.size()), now);
    }

    static String chooseApproach(List<FailureRecord> failures) {
        boolean resource = failures.stream().anyMatch(f -> f.error().contains("resource"));
        if (resource) {
            return TacticalPlan.RESOURCE_OPTIMIZED;
        }
        boolean logic = failures.stream()
                .anyMatch(f -> f.error().contains("logic") || f.error().contains("execution"));
        return logic ? TacticalPlan.ALTERNATIVE_LOGIC : TacticalPlan.CONSERVATIVE_RETRY;
    }

    static double confidence(String approach, int failureCount) {
        double bonus = approach.contains("optimized") ? 0.2 : 0.1;
        return clamp(0.6 - 0.1 * failureCount + bonus);
    }

    static double clamp(double value) {
        return Math.max(0.1, Math.min(0.9, value));
    }
}
