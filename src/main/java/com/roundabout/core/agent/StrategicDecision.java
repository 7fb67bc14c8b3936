package com.roundabout.core.agent;

public record StrategicDecision(Decision decision, String reason, DecisionFactors context) {

    public enum Decision {
        PROCEED,
        HALT_AND_REPORT_FAILURE
    }

    public boolean proceed() {
        return decision == Decision.PROCEED;
    }
}
