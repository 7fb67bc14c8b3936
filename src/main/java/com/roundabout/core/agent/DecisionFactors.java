package com.roundabout.core.agent;

import java.time.Duration;

/**
 * Inputs to the ADAPT strategic decision, kept as the adaptation context
 * handed to INTEGRATE.
 */
public record DecisionFactors(
    boolean resourcesAvailable,
    int failureCount,
    FailureSeverity failureSeverity,
    FailureType failureType,
    int recursionDepth,
    int maxRecursionDepth,
    Duration timeElapsed,
    long maxExecutionTimeMs
) {
}
