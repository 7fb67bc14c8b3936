package com.roundabout.core.model;

import java.time.Instant;

/**
 * Read-only snapshot of an agent.
 */
public record AgentStatus(
    String id,
    CognitivePhase phase,
    boolean active,
    int childCount,
    ResourceUsage resourceUsage,
    Instant lastActivity
) {
}
