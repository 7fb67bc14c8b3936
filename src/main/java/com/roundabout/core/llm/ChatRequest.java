package com.roundabout.core.llm;

/**
 * A single chat-style completion request.
 *
 * @param systemPrompt instructions for the model's role
 * @param userPrompt   the request text
 * @param maxTokens    completion token ceiling
 * @param temperature  sampling temperature
 * @param model        model id chosen from the {@link ModelCatalog} (nullable for the configured default)
 */
public record ChatRequest(
    String systemPrompt,
    String userPrompt,
    int maxTokens,
    double temperature,
    String model
) {
}
