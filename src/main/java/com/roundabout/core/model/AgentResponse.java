package com.roundabout.core.model;

import java.time.Instant;

/**
 * @param text            response text
 * @param type            response classification
 * @param agentState      agent state after processing
 * @param relationalDelta delta computed for the input (nullable when no user state was supplied)
 * @param timestamp       when the response was produced
 */
public record AgentResponse(
    String text,
    ResponseType type,
    AgentState agentState,
    RelationalDelta relationalDelta,
    Instant timestamp
) {
}
