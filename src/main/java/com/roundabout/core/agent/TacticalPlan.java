package com.roundabout.core.agent;

import java.time.Instant;

/**
 * Approach synthesized in INTEGRATE for the next EMERGE attempts.
 */
public record TacticalPlan(String id, String approach, double confidence, Instant createdAt) {

    public static final String RESOURCE_OPTIMIZED = "resource-optimized-approach";
    public static final String ALTERNATIVE_LOGIC = "alternative-logic-approach";
    public static final String CONSERVATIVE_RETRY = "conservative-retry-approach";
}
