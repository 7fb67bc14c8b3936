package com.roundabout.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Alignment between an agent and a user at one point in time. Derived per
 * input, never stored.
 *
 * @param asyncDelta misunderstanding component
 * @param syncDelta  harmony component
 * @param magnitude  euclidean norm of both components
 * @param strategy   recommended communication strategy
 */
public record RelationalDelta(
    double asyncDelta,
    double syncDelta,
    double magnitude,
    CommunicationStrategy strategy
) implements Serializable {

    /** Decay constant for the temporal weight, in milliseconds. */
    public static final double DECAY_MS = 5 * 60 * 1000;
    static final double STRATEGY_THRESHOLD = 0.7;
    static final double MIRROR_THRESHOLD = 0.6;

    /**
     * Pure function of both states: the gap between the two timestamps decays
     * both components, misalignment of the user's problem-solving drive with
     * the agent's confidence drives {@code asyncDelta}, and resonance drives
     * {@code syncDelta}.
     */
    public static RelationalDelta between(AgentState agent, UserState user) {
        long gapMs = Math.abs(Duration.between(user.timestamp(), agent.timestamp()).toMillis());
        double decay = Math.exp(-gapMs / DECAY_MS);
        double alignment = 1 - Math.abs(user.fixes() - agent.confidence());
        double async = (1 - alignment) * decay;
        double sync = agent.resonance() * decay;
        double magnitude = Math.sqrt(async * async + sync * sync);

        CommunicationStrategy strategy;
        if (user.fight() > STRATEGY_THRESHOLD || user.flight() > STRATEGY_THRESHOLD) {
            strategy = CommunicationStrategy.LISTEN;
        } else if (async > MIRROR_THRESHOLD) {
            strategy = CommunicationStrategy.MIRROR;
        } else {
            strategy = CommunicationStrategy.HARMONIZE;
        }
        return new RelationalDelta(async, sync, magnitude, strategy);
    }
}
