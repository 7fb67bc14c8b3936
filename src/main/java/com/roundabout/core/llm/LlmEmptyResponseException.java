package com.roundabout.core.llm;

import com.roundabout.core.RoundaboutException;

/**
 * Thrown when the LLM returns null or blank content instead of a valid response.
 */
public class LlmEmptyResponseException extends RoundaboutException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
