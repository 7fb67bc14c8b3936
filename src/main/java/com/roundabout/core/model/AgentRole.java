package com.roundabout.core.model;

/**
 * Role of an agent in the hierarchy. Selects the EMERGE strategy and the
 * response phrasing.
 */
public enum AgentRole {
    COORDINATOR,
    CONSCIOUS,
    CORE
}
