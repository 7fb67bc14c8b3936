package com.roundabout.core.agent;

import com.roundabout.core.events.EventBus;
import com.roundabout.core.governor.ResourceGovernor;
import com.roundabout.core.llm.LlmService;
import com.roundabout.core.metrics.RoundaboutMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;

/**
 * Collaborators every {@link CognitiveAgent} in a hierarchy shares. Passed
 * from parent to child on clone.
 */
@Component
public class AgentServices {

    private final ResourceGovernor governor;
    private final LlmService llmService;
    private final EventBus eventBus;
    private final RoundaboutMetrics metrics;
    private final AgentProperties properties;
    private final Clock clock;
    private final Random random;
    private final ExecutorService agentExecutor;

    public AgentServices(ResourceGovernor governor, LlmService llmService, EventBus eventBus,
                         RoundaboutMetrics metrics, AgentProperties properties, Clock clock, Random random,
                         @Qualifier("agentExecutor") ExecutorService agentExecutor) {
        this.governor = governor;
        this.llmService = llmService;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
        this.agentExecutor = agentExecutor;
    }

    public ResourceGovernor governor() { return governor; }
    public LlmService llmService() { return llmService; }
    public EventBus eventBus() { return eventBus; }
    public RoundaboutMetrics metrics() { return metrics; }
    public AgentProperties properties() { return properties; }
    public Clock clock() { return clock; }
    public Random random() { return random; }

    /** Runs bounded model calls and concurrent terminations. */
    public ExecutorService agentExecutor() { return agentExecutor; }
}
