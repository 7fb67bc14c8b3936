package com.roundabout.core.agent;

import com.roundabout.core.RoundaboutException;

/**
 * EMERGE could not reach closure. The agent is in ADAPT when this surfaces.
 */
public class EmergenceFailureException extends RoundaboutException {

    private final String detail;

    public EmergenceFailureException(String detail) {
        super("EMERGE phase failed: " + detail);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
