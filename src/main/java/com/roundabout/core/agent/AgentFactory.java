package com.roundabout.core.agent;

import com.roundabout.core.events.AgentEvent;
import com.roundabout.core.model.AgentRole;
import com.roundabout.core.model.ConfigurationProfile;
import com.roundabout.core.model.ContextThread;
import com.roundabout.core.model.ResourceBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and tracks root agents.
 */
@Service
public class AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentFactory.class);

    static final String DEFAULT_GOAL = "Process user input";
    static final String DEFAULT_TASK = "Handle user request";

    private final AgentServices services;
    private final ConcurrentHashMap<String, CognitiveAgent> agents = new ConcurrentHashMap<>();

    public AgentFactory(AgentServices services) {
        this.services = services;
    }

    public CognitiveAgent createAgent(ConfigurationProfile config, AgentRole role) {
        return createAgent(config, role, DEFAULT_GOAL, DEFAULT_TASK);
    }

    /**
     * Builds a root thread (the profile's budget, or the configured default),
     * registers the new agent with the governor and starts tracking it.
     */
    public CognitiveAgent createAgent(ConfigurationProfile config, AgentRole role, String goal, String task) {
        ResourceBudget budget = config.budgetOverride()
                .orElseGet(() -> services.properties().getDefaultBudget().toBudget());
        ContextThread thread = ContextThread.root(goal, task, config, budget, services.clock());
        CognitiveAgent agent = new CognitiveAgent(role, config, thread, null, services);
        services.governor().registerAgent(agent.getId(), thread);
        agents.put(agent.getId(), agent);

        services.metrics().recordAgentLifecycle("created", role.name());
        log.info("Created {} agent {} for goal: {}", role, agent.getId(), goal);
        services.eventBus().publish(new AgentEvent("agent.created", agent.getId(),
                Map.of("role", role.name(), "goal", goal, "task", task), services.clock().instant()));
        return agent;
    }

    public Optional<CognitiveAgent> getAgent(String id) {
        return Optional.ofNullable(agents.get(id));
    }

    public List<CognitiveAgent> listActiveAgents() {
        return agents.values().stream().filter(CognitiveAgent::isActive).toList();
    }

    public int getActiveAgentCount() {
        return listActiveAgents().size();
    }

    /**
     * Terminates every tracked root concurrently, waits for all of them, then
     * stops tracking them. A root whose termination fails is logged and left
     * out of the result; tracking is cleared either way.
     */
    public List<TerminationSummary> terminateAll() {
        List<CognitiveAgent> roots = new ArrayList<>(agents.values());
        try {
            List<CompletableFuture<TerminationSummary>> futures = roots.stream()
                    .map(agent -> CompletableFuture.supplyAsync(agent::terminate, services.agentExecutor())
                            .handle((summary, error) -> {
                                if (error != null) {
                                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                                            ? error.getCause() : error;
                                    log.error("Failed to terminate agent {}: {}", agent.getId(),
                                            cause.getMessage(), cause);
                                    return null;
                                }
                                return summary;
                            }))
                    .toList();
            List<TerminationSummary> summaries = futures.stream()
                    .map(CompletableFuture::join)
                    .filter(Objects::nonNull)
                    .toList();
            log.info("Terminated {} of {} root agents", summaries.size(), roots.size());
            return summaries;
        } finally {
            roots.forEach(agent -> agents.remove(agent.getId()));
        }
    }
}
