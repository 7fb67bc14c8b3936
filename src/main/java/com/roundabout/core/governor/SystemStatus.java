package com.roundabout.core.governor;

import com.roundabout.core.model.ResourceUsage;

public record SystemStatus(
    int activeAgents,
    ResourceUsage totalResourceUsage,
    CircuitBreakerStatus circuitBreakerStatus
) {
}
