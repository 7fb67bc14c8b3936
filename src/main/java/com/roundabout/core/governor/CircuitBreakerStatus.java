package com.roundabout.core.governor;

public enum CircuitBreakerStatus {
    CLOSED,
    OPEN,
    HALF_OPEN
}
