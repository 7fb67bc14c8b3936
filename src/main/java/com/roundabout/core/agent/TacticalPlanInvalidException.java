package com.roundabout.core.agent;

import com.roundabout.core.RoundaboutException;

public class TacticalPlanInvalidException extends RoundaboutException {

    public TacticalPlanInvalidException(String message) {
        super("Failed to create valid tactical plan: " + message);
    }
}
