package com.roundabout.core.governor;

import com.roundabout.core.model.ResourceUsage;

import java.util.List;
import java.util.Set;

/**
 * Detailed governor snapshot including breaker, tempo and pause state.
 */
public record SystemMetrics(
    int activeAgents,
    ResourceUsage totalResourceUsage,
    CircuitBreakerInfo circuitBreakerInfo,
    SystemTempo systemTempo,
    List<ErrorRecord> errorHistory,
    Set<String> pausedHierarchies
) {

    public SystemMetrics {
        errorHistory = List.copyOf(errorHistory);
        pausedHierarchies = Set.copyOf(pausedHierarchies);
    }
}
