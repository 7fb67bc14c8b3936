package com.roundabout.core.health;

import com.roundabout.core.governor.CircuitBreakerInfo;
import com.roundabout.core.governor.ResourceGovernor;
import com.roundabout.core.governor.SystemMetrics;
import com.roundabout.core.llm.LlmProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final ResourceGovernor governor;
    private final LlmProperties llmProperties;

    public HealthCheckService(ResourceGovernor governor, LlmProperties llmProperties) {
        this.governor = governor;
        this.llmProperties = llmProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        SystemMetrics metrics = governor.getSystemMetrics();
        results.add(checkCircuitBreaker(metrics.circuitBreakerInfo()));
        results.add(checkTempo(metrics));
        results.add(checkLlm());
        return results;
    }

    private HealthStatus checkCircuitBreaker(CircuitBreakerInfo info) {
        Map<String, String> metadata = Map.of(
                "errorRate", String.format("%.3f", info.errorRate()),
                "costSpike", String.format("%.2f", info.costSpike()));
        return switch (info.status()) {
            case CLOSED -> new HealthStatus("circuitBreaker", HealthStatus.Status.UP,
                    "Circuit breaker closed", metadata);
            case HALF_OPEN -> new HealthStatus("circuitBreaker", HealthStatus.Status.DEGRADED,
                    "Circuit breaker half-open, probing", metadata);
            case OPEN -> new HealthStatus("circuitBreaker", HealthStatus.Status.DOWN,
                    "Circuit breaker open until " + info.nextRetryAt(), metadata);
        };
    }

    private HealthStatus checkTempo(SystemMetrics metrics) {
        Map<String, String> metadata = Map.of(
                "activeAgents", String.valueOf(metrics.activeAgents()),
                "pausedHierarchies", String.valueOf(metrics.pausedHierarchies().size()));
        String detail = "System tempo " + metrics.systemTempo().label();
        return switch (metrics.systemTempo()) {
            case HIGH_PERFORMANCE -> new HealthStatus("tempo", HealthStatus.Status.UP, detail, metadata);
            case LOW_INTENSITY -> new HealthStatus("tempo", HealthStatus.Status.DEGRADED, detail, metadata);
            case SLEEP -> new HealthStatus("tempo", HealthStatus.Status.DOWN, detail, metadata);
        };
    }

    private HealthStatus checkLlm() {
        if (!llmProperties.isEnabled()) {
            return new HealthStatus("llm", HealthStatus.Status.DEGRADED,
                    "Model calls disabled, coordinators use the local heuristic", Map.of());
        }
        return new HealthStatus("llm", HealthStatus.Status.UP,
                "Model calls enabled (" + llmProperties.getProvider() + ")",
                Map.of("model", String.valueOf(llmProperties.getModel())));
    }
}
