package com.roundabout.core.agent;

import com.roundabout.core.model.ResourceUsage;

/**
 * Probabilistic local closure: charges a fixed compute cost and succeeds
 * with the agent's current success probability.
 */
class HeuristicEmergence implements EmergenceStrategy {

    static final HeuristicEmergence CONSCIOUS = new HeuristicEmergence(5,
            "User interaction handled successfully", "Failed to establish proper user connection");
    static final HeuristicEmergence CORE = new HeuristicEmergence(3,
            "Core task executed successfully", "Core task execution failed");
    /** Coordinator fallback; its compute cost is already charged by {@link CoordinatorEmergence}. */
    static final HeuristicEmergence COORDINATOR_FALLBACK = new HeuristicEmergence(0,
            "Coordination tasks completed successfully", "Failed to coordinate sub-tasks effectively");

    private final long computeUnits;
    private final String successText;
    private final String failureText;

    HeuristicEmergence(long computeUnits, String successText, String failureText) {
        this.computeUnits = computeUnits;
        this.successText = successText;
        this.failureText = failureText;
    }

    @Override
    public EmergenceResult attemptClosure(CognitiveAgent agent) {
        if (computeUnits > 0) {
            agent.consume(ResourceUsage.computeUnits(computeUnits));
        }
        return decide(agent);
    }

    EmergenceResult decide(CognitiveAgent agent) {
        double probability = agent.successProbability();
        return agent.services().random().nextDouble() < probability
                ? EmergenceResult.success(successText)
                : EmergenceResult.failure(failureText);
    }
}
