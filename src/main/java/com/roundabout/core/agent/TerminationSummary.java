package com.roundabout.core.agent;

import com.roundabout.core.model.ChildAgentReport;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate outcome of {@link CognitiveAgent#terminate()}. Always produced,
 * even when individual children fail to terminate.
 */
public record TerminationSummary(String agentId, List<ChildTermination> children, Instant terminatedAt) {

    public TerminationSummary {
        children = List.copyOf(children);
    }

    public List<ChildAgentReport> reports() {
        return children.stream().map(ChildTermination::report).toList();
    }

    public List<ChildTermination.Err> failures() {
        return children.stream()
                .filter(ChildTermination.Err.class::isInstance)
                .map(ChildTermination.Err.class::cast)
                .toList();
    }

    /**
     * Number of agents terminated in this subtree, excluding this agent.
     */
    public int descendantCount() {
        int count = 0;
        for (ChildTermination child : children) {
            count++;
            if (child instanceof ChildTermination.Ok ok) {
                count += ok.subtree().descendantCount();
            }
        }
        return count;
    }
}
