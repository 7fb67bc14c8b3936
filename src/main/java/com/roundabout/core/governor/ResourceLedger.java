package com.roundabout.core.governor;

import com.roundabout.core.model.ResourceUsage;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-agent cumulative usage plus per-user time-stamped usage history.
 * <p>
 * Updates are atomic per key ({@link ConcurrentHashMap#merge}); user history
 * entries are immutable lists replaced on every update and pruned to the
 * retention window.
 */
@Component
public class ResourceLedger {

    static final Duration USER_HISTORY_RETENTION = Duration.ofHours(24);

    record UsageSample(Instant timestamp, ResourceUsage usage) {
    }

    private final ConcurrentHashMap<String, ResourceUsage> agentUsage = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<UsageSample>> userHistory = new ConcurrentHashMap<>();

    /**
     * Adds {@code delta} to the agent's entry, creating it lazily.
     *
     * @return the agent's cumulative usage after the addition
     */
    public ResourceUsage add(String agentId, ResourceUsage delta) {
        return agentUsage.merge(agentId, delta, ResourceUsage::plus);
    }

    public ResourceUsage usageOf(String agentId) {
        return agentUsage.getOrDefault(agentId, ResourceUsage.ZERO);
    }

    public boolean hasEntry(String agentId) {
        return agentUsage.containsKey(agentId);
    }

    public void remove(String agentId) {
        agentUsage.remove(agentId);
    }

    public ResourceUsage total() {
        ResourceUsage total = ResourceUsage.ZERO;
        for (ResourceUsage usage : agentUsage.values()) {
            total = total.plus(usage);
        }
        return total;
    }

    public Map<String, ResourceUsage> entries() {
        return Map.copyOf(agentUsage);
    }

    public void attributeToUser(String userId, ResourceUsage delta, Instant at) {
        Instant cutoff = at.minus(USER_HISTORY_RETENTION);
        userHistory.compute(userId, (id, history) -> {
            List<UsageSample> next = new ArrayList<>();
            if (history != null) {
                for (UsageSample sample : history) {
                    if (sample.timestamp().isAfter(cutoff)) {
                        next.add(sample);
                    }
                }
            }
            next.add(new UsageSample(at, delta));
            return List.copyOf(next);
        });
    }

    /**
     * Aggregates a user's usage recorded at or after {@code since}. LLM calls,
     * compute and execution time are summed; storage is the largest single
     * sample, since storage deltas describe occupancy rather than throughput.
     */
    public ResourceUsage userUsageSince(String userId, Instant since) {
        List<UsageSample> history = userHistory.getOrDefault(userId, List.of());
        long llmCalls = 0;
        long computeUnits = 0;
        long storageBytes = 0;
        long executionTimeMs = 0;
        for (UsageSample sample : history) {
            if (sample.timestamp().isBefore(since)) {
                continue;
            }
            ResourceUsage usage = sample.usage();
            llmCalls += usage.llmCalls();
            computeUnits += usage.computeUnits();
            storageBytes = Math.max(storageBytes, usage.storageBytes());
            executionTimeMs += usage.executionTimeMs();
        }
        return new ResourceUsage(llmCalls, computeUnits, storageBytes, executionTimeMs);
    }
}
