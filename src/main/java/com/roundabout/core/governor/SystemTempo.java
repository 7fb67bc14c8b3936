package com.roundabout.core.governor;

/**
 * Global throttling level, ordered from least to most restrictive.
 */
public enum SystemTempo {
    HIGH_PERFORMANCE("High-Performance"),
    LOW_INTENSITY("Low-Intensity"),
    SLEEP("Sleep");

    private final String label;

    SystemTempo(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Next more restrictive level; SLEEP stays SLEEP. */
    public SystemTempo slower() {
        return this == HIGH_PERFORMANCE ? LOW_INTENSITY : SLEEP;
    }

    /** Next less restrictive level; HIGH_PERFORMANCE stays HIGH_PERFORMANCE. */
    public SystemTempo faster() {
        return this == SLEEP ? LOW_INTENSITY : HIGH_PERFORMANCE;
    }
}
