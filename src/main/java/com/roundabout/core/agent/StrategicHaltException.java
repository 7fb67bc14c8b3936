package com.roundabout.core.agent;

import com.roundabout.core.RoundaboutException;

/**
 * ADAPT decided HALT_AND_REPORT_FAILURE. Terminal for the agent: the loop
 * must not be resumed.
 */
public class StrategicHaltException extends RoundaboutException {

    private final StrategicDecision decision;

    public StrategicHaltException(StrategicDecision decision) {
        super("Agent halted: " + decision.reason());
        this.decision = decision;
    }

    public StrategicDecision getDecision() {
        return decision;
    }
}
