package com.roundabout.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle, phase or governance event emitted by an agent or the governor.
 *
 * @param eventType event type (e.g. "agent.phase.changed", "governor.approval.denied")
 * @param agentId   agent the event relates to (nullable for system-wide events)
 * @param detail    arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AgentEvent(
    String eventType,
    String agentId,
    Map<String, Object> detail,
    Instant timestamp
) implements Serializable {

    public AgentEvent {
        detail = detail == null ? Map.of() : Map.copyOf(detail);
    }
}
