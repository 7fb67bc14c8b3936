package com.roundabout.core.agent;

public enum FailureSeverity {
    MINOR,
    MODERATE,
    CRITICAL
}
