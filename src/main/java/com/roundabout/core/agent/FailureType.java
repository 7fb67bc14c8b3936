package com.roundabout.core.agent;

public enum FailureType {
    RESOURCE,
    LOGIC,
    EXTERNAL,
    TIMEOUT
}
