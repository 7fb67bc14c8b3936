package com.roundabout.core.model;

/**
 * Phases of the Roundabout loop. There is no terminal phase: a healthy agent
 * cycles EMERGE, and only failures route it through ADAPT and INTEGRATE.
 */
public enum CognitivePhase {
    EMERGE,
    ADAPT,
    INTEGRATE
}
