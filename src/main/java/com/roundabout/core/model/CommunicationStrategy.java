package com.roundabout.core.model;

/**
 * Communication strategy recommended by a {@link RelationalDelta}.
 */
public enum CommunicationStrategy {
    MIRROR,
    HARMONIZE,
    LISTEN
}
