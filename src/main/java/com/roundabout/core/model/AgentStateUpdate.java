package com.roundabout.core.model;

/**
 * Partial update to an {@link AgentState}; null fields are left unchanged.
 */
public record AgentStateUpdate(Double resonance, Double confidence) {

    public static AgentStateUpdate resonance(double value) {
        return new AgentStateUpdate(value, null);
    }

    public static AgentStateUpdate confidence(double value) {
        return new AgentStateUpdate(null, value);
    }
}
