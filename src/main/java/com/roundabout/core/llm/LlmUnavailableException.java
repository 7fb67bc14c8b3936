package com.roundabout.core.llm;

import com.roundabout.core.RoundaboutException;

/**
 * Thrown when model calls are disabled by configuration.
 */
public class LlmUnavailableException extends RoundaboutException {

    public LlmUnavailableException(String message) {
        super(message);
    }
}
