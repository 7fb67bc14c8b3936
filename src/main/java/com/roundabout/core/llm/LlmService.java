package com.roundabout.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} for the plain-text completions agents
 * request during EMERGE.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;

    @Autowired
    public LlmService(ChatClient.Builder builder, LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this(builder.build(), properties);
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    LlmService(ChatClient chatClient, LlmProperties properties) {
        this.chatClient = chatClient;
        this.properties = properties;
    }

    /**
     * Sends a system + user prompt and returns the model's text.
     *
     * @throws LlmUnavailableException   when model calls are disabled
     * @throws LlmEmptyResponseException when the model returns no content
     */
    public String chat(ChatRequest request) {
        if (!properties.isEnabled()) {
            throw new LlmUnavailableException("LLM calls are disabled (roundabout.llm.enabled=false)");
        }
        String model = request.model() != null ? request.model() : properties.getModel();
        var options = ChatOptions.builder()
                .model(model)
                .maxTokens(request.maxTokens())
                .temperature(request.temperature())
                .build();
        log.info("LLM call started → {} (maxTokens={})", model, request.maxTokens());
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(request.systemPrompt())
                .user(request.userPrompt())
                .options(options)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", model, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content from " + model);
        }
        return response.trim();
    }
}
