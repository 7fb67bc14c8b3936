package com.roundabout.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Capabilities and constraints an agent is configured with.
 *
 * @param llmModel          model the agent prefers for completions
 * @param toolkit           tool names available to the agent
 * @param memoryScope       memory access scope, {@code user:<id>} identifies the owning user
 * @param entryPhase        phase the agent starts in
 * @param maxRecursionDepth optional per-agent recursion ceiling (nullable)
 * @param resourceBudget    optional explicit budget (nullable)
 */
public record ConfigurationProfile(
    String llmModel,
    List<String> toolkit,
    String memoryScope,
    CognitivePhase entryPhase,
    Integer maxRecursionDepth,
    ResourceBudget resourceBudget
) implements Serializable {

    public ConfigurationProfile {
        toolkit = toolkit == null ? List.of() : List.copyOf(toolkit);
        entryPhase = entryPhase == null ? CognitivePhase.EMERGE : entryPhase;
    }

    /**
     * A profile entering EMERGE with no budget or depth override.
     */
    public static ConfigurationProfile of(String llmModel, String memoryScope) {
        return new ConfigurationProfile(llmModel, List.of("basic"), memoryScope, CognitivePhase.EMERGE, null, null);
    }

    public ConfigurationProfile withResourceBudget(ResourceBudget budget) {
        return new ConfigurationProfile(llmModel, toolkit, memoryScope, entryPhase, maxRecursionDepth, budget);
    }

    public ConfigurationProfile withMaxRecursionDepth(Integer depth) {
        return new ConfigurationProfile(llmModel, toolkit, memoryScope, entryPhase, depth, resourceBudget);
    }

    public ConfigurationProfile withEntryPhase(CognitivePhase phase) {
        return new ConfigurationProfile(llmModel, toolkit, memoryScope, phase, maxRecursionDepth, resourceBudget);
    }

    public Optional<ResourceBudget> budgetOverride() {
        return Optional.ofNullable(resourceBudget);
    }

    public int maxRecursionDepthOr(int fallback) {
        return maxRecursionDepth != null ? maxRecursionDepth : fallback;
    }
}
