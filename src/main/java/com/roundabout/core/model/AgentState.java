package com.roundabout.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Internal state of an agent, compared against a {@link UserState} when
 * computing a {@link RelationalDelta}.
 *
 * @param phase      current loop phase
 * @param resonance  emotional resonance with the user, in [0,1]
 * @param confidence problem-solving confidence, in [0,1]
 * @param timestamp  when this state was captured
 */
public record AgentState(
    CognitivePhase phase,
    double resonance,
    double confidence,
    Instant timestamp
) implements Serializable {

    public static final double INITIAL_RESONANCE = 0.5;
    public static final double INITIAL_CONFIDENCE = 0.7;

    public AgentState {
        requireUnit("resonance", resonance);
        requireUnit("confidence", confidence);
    }

    public static AgentState initial(CognitivePhase phase, Instant now) {
        return new AgentState(phase, INITIAL_RESONANCE, INITIAL_CONFIDENCE, now);
    }

    public AgentState withPhase(CognitivePhase newPhase, Instant now) {
        return new AgentState(newPhase, resonance, confidence, now);
    }

    /**
     * Applies the non-null fields of {@code update} and restamps the state.
     */
    public AgentState apply(AgentStateUpdate update, Instant now) {
        return new AgentState(phase,
                update.resonance() != null ? update.resonance() : resonance,
                update.confidence() != null ? update.confidence() : confidence,
                now);
    }

    static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1]: " + value);
        }
    }
}
