package com.roundabout.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Emotional state vector produced by the external emotion/context provider.
 *
 * @param fight      aggression / confrontation, in [0,1]
 * @param flight     avoidance / withdrawal, in [0,1]
 * @param fixes      problem-solving orientation, in [0,1]
 * @param timestamp  capture time, used only for decay weighting
 * @param confidence provider confidence, in [0,1]
 */
public record UserState(
    double fight,
    double flight,
    double fixes,
    Instant timestamp,
    double confidence
) implements Serializable {

    public UserState {
        AgentState.requireUnit("fight", fight);
        AgentState.requireUnit("flight", flight);
        AgentState.requireUnit("fixes", fixes);
        AgentState.requireUnit("confidence", confidence);
    }
}
