package com.roundabout.core.governor;

import java.time.Instant;

/**
 * @param status        current breaker state
 * @param errorRate     error rate over the sliding window
 * @param costSpike     average cost over the window divided by the baseline
 * @param lastTriggered when the breaker last opened (nullable)
 * @param nextRetryAt   when an open breaker moves to half-open (nullable)
 */
public record CircuitBreakerInfo(
    CircuitBreakerStatus status,
    double errorRate,
    double costSpike,
    Instant lastTriggered,
    Instant nextRetryAt
) {
}
