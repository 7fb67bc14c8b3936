package com.roundabout.core.agent;

import com.roundabout.core.model.AgentRole;

/**
 * Role-specific closure attempt run in EMERGE.
 */
public interface EmergenceStrategy {

    EmergenceResult attemptClosure(CognitiveAgent agent);

    static EmergenceStrategy forRole(AgentRole role) {
        return switch (role) {
            case COORDINATOR -> new CoordinatorEmergence();
            case CONSCIOUS -> HeuristicEmergence.CONSCIOUS;
            case CORE -> HeuristicEmergence.CORE;
        };
    }
}
