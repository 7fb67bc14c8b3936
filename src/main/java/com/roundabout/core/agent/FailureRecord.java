package com.roundabout.core.agent;

import com.roundabout.core.model.CognitivePhase;

import java.time.Instant;

public record FailureRecord(CognitivePhase phase, String error, Instant timestamp) {

    public FailureRecord {
        error = error == null ? "Unknown error" : error;
    }
}
