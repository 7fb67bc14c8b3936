package com.roundabout.core.governor;

import com.roundabout.core.events.AgentEvent;
import com.roundabout.core.events.EventBus;
import com.roundabout.core.metrics.RoundaboutMetrics;
import com.roundabout.core.model.ContextThread;
import com.roundabout.core.model.ResourceBudget;
import com.roundabout.core.model.ResourceUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Central admission control for every resource-consuming operation.
 * <p>
 * Checks run in a fixed order and the first failing one wins: hierarchy pause,
 * circuit breaker, tempo, then operation-specific validation. The governor
 * also owns the usage ledger, user quotas, the error and cost windows that
 * drive the breaker and tempo, and the set of paused hierarchies.
 */
@Service
public class ResourceGovernor {

    private static final Logger log = LoggerFactory.getLogger(ResourceGovernor.class);

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofHours(24);

    /** Registration of a live agent: hierarchy links, budget and owning user. */
    record AgentRegistration(String agentId, String parentAgentId, String userId, ResourceBudget budget) {
    }

    private final GovernorProperties properties;
    private final ResourceLedger ledger;
    private final CircuitBreaker breaker;
    private final SystemTempoController tempo;
    private final EventBus eventBus;
    private final RoundaboutMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, AgentRegistration> registry = new ConcurrentHashMap<>();
    private final Set<String> activeAgents = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, String> pausedHierarchies = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, UserResourceQuotas> userQuotas = new ConcurrentHashMap<>();
    private final SlidingWindow<ErrorRecord> errorWindow;
    private final SlidingWindow<Long> costWindow;

    public ResourceGovernor(GovernorProperties properties, ResourceLedger ledger, CircuitBreaker breaker,
                            SystemTempoController tempo, EventBus eventBus, RoundaboutMetrics metrics,
                            Clock clock) {
        this.properties = properties;
        this.ledger = ledger;
        this.breaker = breaker;
        this.tempo = tempo;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        Duration window = properties.getCircuitBreaker().getTimeWindow();
        this.errorWindow = new SlidingWindow<>(window, clock);
        this.costWindow = new SlidingWindow<>(window, clock);
    }

    // --- Admission control ---

    public ApprovalResponse requestApproval(ApprovalRequest request) {
        ApprovalResponse response = evaluate(request);
        if (response.approved()) {
            breaker.recordProbeSuccess();
        }
        String denial = response.denialReason().map(Enum::name).orElse(null);
        metrics.recordApproval(request.operation().wireName(), response.approved(), denial);
        Map<String, Object> detail = new HashMap<>();
        detail.put("operation", request.operation().wireName());
        detail.put("reason", response.reason());
        if (denial != null) {
            detail.put("denial", denial);
        }
        eventBus.publish(new AgentEvent(
                response.approved() ? "governor.approval.granted" : "governor.approval.denied",
                request.requestingAgentId(), detail, clock.instant()));
        if (response.approved()) {
            log.debug("Approved {} for agent {}: {}", request.operation().wireName(),
                    request.requestingAgentId(), response.reason());
        } else {
            log.info("Denied {} for agent {}: {}", request.operation().wireName(),
                    request.requestingAgentId(), response.reason());
        }
        return response;
    }

    private ApprovalResponse evaluate(ApprovalRequest request) {
        String pausedRoot = findPausedAncestor(request);
        if (pausedRoot != null) {
            return ApprovalResponse.deny(DenialReason.HIERARCHY_PAUSED,
                    "Agent hierarchy " + pausedRoot + " is paused: " + pausedHierarchies.get(pausedRoot));
        }

        if (breaker.status() == CircuitBreakerStatus.OPEN) {
            return ApprovalResponse.deny(DenialReason.CIRCUIT_BREAKER_OPEN,
                    "System circuit breaker is open due to high error rate or cost spike");
        }

        SystemTempo currentTempo = tempo.current();
        ApprovalRequest adjusted = request.withEstimatedCost(
                SystemTempoController.adjust(currentTempo, request.operation(), request.estimatedCost()));
        if (currentTempo == SystemTempo.SLEEP && request.operation() != OperationType.MEMORY_ACCESS) {
            return ApprovalResponse.deny(DenialReason.SLEEP_TEMPO,
                    "System is in Sleep mode - only critical operations allowed");
        }

        return switch (adjusted.operation()) {
            case CLONE_AGENT -> validateCloning(adjusted);
            case LLM_CALL -> validateLlmCall(adjusted);
            case MEMORY_ACCESS -> ApprovalResponse.approve("Memory access approved");
            case EXTERNAL_API -> ApprovalResponse.approve("External API call approved");
            case AUTONOMOUS_MODE -> ApprovalResponse.deny(DenialReason.UNSUPPORTED_OPERATION,
                    "Unsupported operation type: " + adjusted.operation().wireName());
        };
    }

    private ApprovalResponse validateCloning(ApprovalRequest request) {
        ContextThread thread = request.contextThread();
        int maxDepth = properties.getMaxRecursionDepth();
        if (thread.recursionDepth() >= maxDepth) {
            return ApprovalResponse.deny(DenialReason.RECURSION_LIMIT_EXCEEDED,
                    "Maximum recursion depth (" + maxDepth + ") exceeded");
        }

        int maxSystem = properties.getMaxSystemAgents();
        if (activeAgents.size() >= maxSystem) {
            return ApprovalResponse.deny(DenialReason.SYSTEM_AGENT_CAP_EXCEEDED,
                    "Maximum system agents (" + maxSystem + ") exceeded");
        }

        String userId = thread.userId();
        int maxPerUser = properties.getMaxActiveAgentsPerUser();
        if (countAgentsOf(userId) >= maxPerUser) {
            return ApprovalResponse.deny(DenialReason.USER_AGENT_CAP_EXCEEDED,
                    "Maximum active agents per user (" + maxPerUser + ") exceeded for " + userId);
        }

        ResourceUsage projected = ledger.usageOf(request.requestingAgentId()).plus(request.estimatedCost());
        ResourceBudget parentBudget = parentBudgetFor(request);
        if (projected.exceedsFraction(parentBudget, properties.getCloneBudgetThreshold())) {
            return ApprovalResponse.deny(DenialReason.BUDGET_INSUFFICIENT,
                    "Insufficient resource budget for agent cloning");
        }
        return ApprovalResponse.approve("Agent cloning approved", projected);
    }

    private ApprovalResponse validateLlmCall(ApprovalRequest request) {
        ResourceUsage estimate = request.estimatedCost();
        if (estimate.llmCalls() == 0) {
            estimate = new ResourceUsage(1, estimate.computeUnits(), estimate.storageBytes(),
                    estimate.executionTimeMs());
        }
        ResourceUsage projected = ledger.usageOf(request.requestingAgentId()).plus(estimate);
        if (projected.exceeds(request.contextThread().resourceBudget())) {
            return ApprovalResponse.deny(DenialReason.BUDGET_INSUFFICIENT, "LLM call quota exceeded");
        }

        String userId = request.contextThread().userId();
        List<String> violations = new ArrayList<>(checkUserQuotas(userId).violations());
        Object requestedTokens = request.parameters().get(ApprovalRequest.PARAM_MAX_TOKENS);
        if (requestedTokens instanceof Number tokens) {
            long maxTokens = getUserQuotas(userId).llmQuota().maxTokensPerCall();
            if (tokens.longValue() > maxTokens) {
                violations.add("Tokens per call exceeded: " + tokens.longValue() + "/" + maxTokens);
            }
        }
        if (!violations.isEmpty()) {
            return ApprovalResponse.deny(DenialReason.QUOTA_VIOLATION,
                    "User quota violations: " + String.join(", ", violations), violations);
        }
        return ApprovalResponse.approve("LLM call approved", projected);
    }

    // --- Usage, errors and signals ---

    /**
     * Adds {@code delta} to the agent's ledger entry, attributes it to the
     * owning user and feeds the cost-spike detector with the agent's
     * cumulative cost. Usage reported for an agent that is not registered
     * (never registered, or already removed) is ignored.
     */
    public void updateResourceUsage(String agentId, ResourceUsage delta) {
        AtomicReference<ResourceUsage> cumulative = new AtomicReference<>();
        AgentRegistration registration = registry.computeIfPresent(agentId, (id, current) -> {
            cumulative.set(ledger.add(id, delta));
            return current;
        });
        if (registration == null) {
            log.debug("Ignoring usage reported for unregistered agent {}", agentId);
            return;
        }
        ledger.attributeToUser(registration.userId(), delta, clock.instant());
        evaluateCost(agentId, cumulative.get().weightedCost());
    }

    private void evaluateCost(String agentId, long cost) {
        List<Long> costs = costWindow.add(cost);
        double average = average(costs);
        double costSpike = average / properties.getCircuitBreaker().getBaselineCost();
        GovernorProperties.Breaker config = properties.getCircuitBreaker();
        if (costSpike > config.getCostSpikeThreshold()
                && average > config.getMinAverageCost()
                && costs.size() > config.getMinCostSamples()) {
            if (breaker.tryOpen("Cost spike detected")) {
                pauseAgentHierarchy(rootOf(agentId), "Cost spike detected");
            }
        }
        tempo.observe(currentErrorRate(), costSpike);
    }

    /**
     * Records an operational error. While half-open any error re-opens the breaker.
     */
    public void recordError(String agentId, String message) {
        record(agentId, message, true);
    }

    /**
     * Records an operation this governor refused. Denials count toward the
     * error rate but never re-open a half-open breaker.
     */
    public void recordDenial(String agentId, String message) {
        record(agentId, message, false);
    }

    private void record(String agentId, String message, boolean reopensHalfOpen) {
        List<ErrorRecord> recent = errorWindow.add(new ErrorRecord(agentId, clock.instant(), message));
        metrics.recordErrorReported();
        log.debug("Error recorded for agent {}: {}", agentId, message);
        double errorRate = errorRate(recent.size());
        GovernorProperties.Breaker config = properties.getCircuitBreaker();
        if (breaker.status() == CircuitBreakerStatus.HALF_OPEN) {
            if (reopensHalfOpen) {
                breaker.tryOpen("Error while half-open");
            }
        } else if (recent.size() >= config.getMinErrorSamples() && errorRate > config.getErrorRateThreshold()) {
            breaker.tryOpen("High error rate detected");
        }
        tempo.observe(errorRate, currentCostSpike());
    }

    private double currentErrorRate() {
        return errorRate(errorWindow.size());
    }

    private double errorRate(int recentErrors) {
        int estimatedOperations = Math.max(activeAgents.size() * 10, 10);
        return (double) recentErrors / estimatedOperations;
    }

    private double currentCostSpike() {
        return average(costWindow.snapshot()) / properties.getCircuitBreaker().getBaselineCost();
    }

    private static double average(List<Long> costs) {
        if (costs.isEmpty()) {
            return 0.0;
        }
        long sum = 0;
        for (long cost : costs) {
            sum += cost;
        }
        return (double) sum / costs.size();
    }

    // --- Agent registry ---

    public void registerAgent(String agentId, ContextThread thread) {
        registry.put(agentId, new AgentRegistration(agentId, thread.parentAgentId(), thread.userId(),
                thread.resourceBudget()));
        activeAgents.add(agentId);
        log.debug("Registered agent {} (parent={}, user={})", agentId, thread.parentAgentId(), thread.userId());
    }

    /**
     * Removes the agent's ledger entry and registration.
     */
    public void removeAgent(String agentId) {
        // registration goes first so a concurrent usage update cannot recreate the ledger entry
        registry.remove(agentId);
        ledger.remove(agentId);
        activeAgents.remove(agentId);
        log.debug("Removed agent {}", agentId);
    }

    /**
     * True while the agent's recorded usage is within its thread's budget in every dimension.
     */
    public boolean checkResourceLimits(String agentId, ContextThread thread) {
        if (!ledger.hasEntry(agentId)) {
            return true;
        }
        return !ledger.usageOf(agentId).exceeds(thread.resourceBudget());
    }

    public ResourceUsage getUsage(String agentId) {
        return ledger.usageOf(agentId);
    }

    private int countAgentsOf(String userId) {
        int count = 0;
        for (AgentRegistration registration : registry.values()) {
            if (registration.userId().equals(userId)) {
                count++;
            }
        }
        return count;
    }

    private ResourceBudget parentBudgetFor(ApprovalRequest request) {
        AgentRegistration requester = registry.get(request.requestingAgentId());
        if (requester != null) {
            return requester.budget();
        }
        String parentId = request.contextThread().parentAgentId();
        AgentRegistration parent = parentId != null ? registry.get(parentId) : null;
        return parent != null ? parent.budget() : request.contextThread().resourceBudget();
    }

    String rootOf(String agentId) {
        String current = agentId;
        Set<String> seen = new HashSet<>();
        while (seen.add(current)) {
            AgentRegistration registration = registry.get(current);
            if (registration == null || registration.parentAgentId() == null) {
                return current;
            }
            current = registration.parentAgentId();
        }
        return current;
    }

    private String findPausedAncestor(ApprovalRequest request) {
        if (pausedHierarchies.isEmpty()) {
            return null;
        }
        String paused = findPausedOnChain(request.requestingAgentId());
        if (paused == null && request.contextThread() != null && request.contextThread().parentAgentId() != null) {
            paused = findPausedOnChain(request.contextThread().parentAgentId());
        }
        return paused;
    }

    private String findPausedOnChain(String agentId) {
        String current = agentId;
        Set<String> seen = new HashSet<>();
        while (current != null && seen.add(current)) {
            if (pausedHierarchies.containsKey(current)) {
                return current;
            }
            AgentRegistration registration = registry.get(current);
            current = registration != null ? registration.parentAgentId() : null;
        }
        return null;
    }

    // --- Hierarchy pause ---

    public void pauseAgentHierarchy(String rootAgentId, String reason) {
        pausedHierarchies.put(rootAgentId, reason);
        log.warn("Paused agent hierarchy {}: {}", rootAgentId, reason);
        eventBus.publish(new AgentEvent("governor.hierarchy.paused", rootAgentId,
                Map.of("reason", reason), clock.instant()));
    }

    public void resumeAgentHierarchy(String rootAgentId) {
        if (pausedHierarchies.remove(rootAgentId) != null) {
            log.info("Resumed agent hierarchy {}", rootAgentId);
            eventBus.publish(new AgentEvent("governor.hierarchy.resumed", rootAgentId, Map.of(), clock.instant()));
        }
    }

    public boolean isHierarchyPaused(String rootAgentId) {
        return pausedHierarchies.containsKey(rootAgentId);
    }

    // --- Quotas ---

    public UserResourceQuotas getUserQuotas(String userId) {
        return userQuotas.computeIfAbsent(userId,
                id -> properties.getQuotas().forTier(QuotaTier.FREE).toQuotas(id, QuotaTier.FREE));
    }

    public void setUserQuotas(String userId, UserResourceQuotas quotas) {
        userQuotas.put(userId, quotas.withUserId(userId));
        log.info("Quotas for user {} set to tier {}", userId, quotas.tier());
    }

    public QuotaCheckResult checkUserQuotas(String userId) {
        UserResourceQuotas quotas = getUserQuotas(userId);
        Instant now = clock.instant();
        ResourceUsage hourly = ledger.userUsageSince(userId, now.minus(HOUR));
        ResourceUsage daily = ledger.userUsageSince(userId, now.minus(DAY));
        List<String> violations = new ArrayList<>();

        UserResourceQuotas.LlmQuota llm = quotas.llmQuota();
        if (hourly.llmCalls() > llm.maxCallsPerHour()) {
            violations.add("LLM calls per hour exceeded: " + hourly.llmCalls() + "/" + llm.maxCallsPerHour());
        }
        if (daily.llmCalls() > llm.maxCallsPerDay()) {
            violations.add("LLM calls per day exceeded: " + daily.llmCalls() + "/" + llm.maxCallsPerDay());
        }

        UserResourceQuotas.ComputeQuota compute = quotas.computeQuota();
        if (hourly.computeUnits() > compute.maxUnitsPerHour()) {
            violations.add("Compute units per hour exceeded: " + hourly.computeUnits() + "/"
                    + compute.maxUnitsPerHour());
        }
        if (daily.computeUnits() > compute.maxUnitsPerDay()) {
            violations.add("Compute units per day exceeded: " + daily.computeUnits() + "/"
                    + compute.maxUnitsPerDay());
        }

        UserResourceQuotas.StorageQuota storage = quotas.storageQuota();
        if (daily.storageBytes() > storage.maxTotalBytes()) {
            violations.add("Storage quota exceeded: " + daily.storageBytes() + "/" + storage.maxTotalBytes()
                    + " bytes");
        }
        return QuotaCheckResult.of(violations);
    }

    // --- Breaker and tempo ---

    public void setSystemTempo(SystemTempo target) {
        tempo.set(target);
    }

    public SystemTempo getSystemTempo() {
        return tempo.current();
    }

    public void setCircuitBreakerState(CircuitBreakerStatus state) {
        breaker.force(state);
    }

    public CircuitBreakerStatus getCircuitBreakerStatus() {
        return breaker.status();
    }

    // --- Snapshots ---

    public SystemStatus getSystemStatus() {
        return new SystemStatus(activeAgents.size(), ledger.total(), breaker.status());
    }

    public SystemMetrics getSystemMetrics() {
        return new SystemMetrics(
                activeAgents.size(),
                ledger.total(),
                breaker.info(currentErrorRate(), currentCostSpike()),
                tempo.current(),
                errorWindow.snapshot(),
                pausedHierarchies.keySet());
    }
}
