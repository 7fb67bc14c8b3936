package com.roundabout.core.agent;

import com.roundabout.core.events.AgentEvent;
import com.roundabout.core.governor.ApprovalDeniedException;
import com.roundabout.core.governor.ApprovalRequest;
import com.roundabout.core.governor.ApprovalResponse;
import com.roundabout.core.governor.DenialReason;
import com.roundabout.core.governor.OperationType;
import com.roundabout.core.logging.MdcContext;
import com.roundabout.core.model.AgentResponse;
import com.roundabout.core.model.AgentRole;
import com.roundabout.core.model.AgentState;
import com.roundabout.core.model.AgentStateUpdate;
import com.roundabout.core.model.AgentStatus;
import com.roundabout.core.model.ChildAgentReport;
import com.roundabout.core.model.CognitivePhase;
import com.roundabout.core.model.ConfigurationProfile;
import com.roundabout.core.model.ContextThread;
import com.roundabout.core.model.RelationalDelta;
import com.roundabout.core.model.ReportStatus;
import com.roundabout.core.model.ResourceBudget;
import com.roundabout.core.model.ResourceUsage;
import com.roundabout.core.model.ResponseType;
import com.roundabout.core.model.UserInput;
import com.roundabout.core.model.UserState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The execution unit of a hierarchy. Runs the EMERGE / ADAPT / INTEGRATE
 * loop, delegates work to governor-approved children, and on termination
 * cascades shutdown through its subtree while collecting reports.
 * <p>
 * Loop steps for one agent are serialized; clones are serialized separately
 * so a child can be spawned while a loop step waits on the model.
 */
public class CognitiveAgent {

    private static final Logger log = LoggerFactory.getLogger(CognitiveAgent.class);

    static final long INTEGRATE_COMPUTE_UNITS = 5;

    private final String id;
    private final AgentRole role;
    private final ConfigurationProfile configurationProfile;
    private final String rootAgentId;
    private final AgentServices services;
    private final EmergenceStrategy emergence;
    private final StrategicDecisionPolicy decisionPolicy;

    private final Object loopLock = new Object();
    private final Object stateLock = new Object();
    private final Object terminationLock = new Object();
    private final ReentrantLock cloneLock = new ReentrantLock();
    private final ConcurrentHashMap<String, CognitiveAgent> children = new ConcurrentHashMap<>();

    private volatile ContextThread contextThread;
    private volatile Instant lastActivity;
    private volatile boolean active = true;
    private volatile boolean halted;

    // guarded by stateLock
    private CognitivePhase phase;
    private AgentState state;
    private ResourceUsage usage = ResourceUsage.ZERO;
    private final List<FailureRecord> failures = new ArrayList<>();

    // guarded by loopLock
    private StrategicDecision adaptationContext;
    private volatile TacticalPlan currentPlan;

    // guarded by terminationLock
    private TerminationSummary terminationSummary;

    /**
     * @param rootAgentId root of the hierarchy this agent belongs to, null for a root agent
     */
    public CognitiveAgent(AgentRole role, ConfigurationProfile configurationProfile, ContextThread contextThread,
                          String rootAgentId, AgentServices services) {
        this.id = UUID.randomUUID().toString();
        this.role = role;
        this.configurationProfile = configurationProfile;
        this.contextThread = contextThread;
        this.rootAgentId = rootAgentId != null ? rootAgentId : id;
        this.services = services;
        this.emergence = EmergenceStrategy.forRole(role);
        this.decisionPolicy = new StrategicDecisionPolicy(services.properties().getHaltElapsedFraction());
        Instant now = services.clock().instant();
        this.phase = configurationProfile.entryPhase();
        this.state = AgentState.initial(phase, now);
        this.lastActivity = now;
    }

    // --- Input processing and the loop ---

    /**
     * Runs one loop iteration and answers the input. Charges one LLM call plus
     * compute proportional to the input length. Any failure leaves the agent
     * in ADAPT and is rethrown.
     *
     * @throws ApprovalDeniedException the charge would take usage past the thread budget
     */
    public AgentResponse processInput(UserInput input) {
        requireRunnable();
        touch();
        ResourceUsage charge = new ResourceUsage(1, Math.max(1, input.text().length() / 100), 0, 0);
        synchronized (loopLock) {
            try {
                requireBudgetFor(charge);
                executeLoopStep();
                RelationalDelta delta = input.userStateOpt().map(this::calculateRelationalDelta).orElse(null);
                String text = ResponseComposer.compose(role, input, delta);
                AgentResponse response = new AgentResponse(text, ResponseType.MESSAGE, getState(), delta,
                        services.clock().instant());
                requireBudgetFor(charge);
                consume(charge);
                return response;
            } catch (RuntimeException e) {
                transition(CognitivePhase.ADAPT);
                throw e;
            }
        }
    }

    /**
     * Executes the step for the current phase.
     *
     * @throws EmergenceFailureException    EMERGE failed; the agent is now in ADAPT
     * @throws StrategicHaltException       ADAPT decided to halt; the agent accepts no further loop steps
     * @throws TacticalPlanInvalidException INTEGRATE could not produce a plan; the agent is now in ADAPT
     * @throws AgentHaltedException         the agent has halted or been terminated
     */
    public void executeRoundaboutLoop() {
        requireRunnable();
        touch();
        synchronized (loopLock) {
            executeLoopStep();
        }
    }

    private void executeLoopStep() {
        CognitivePhase current = getPhase();
        MdcContext.setPhase(id, rootAgentId, current.name());
        long start = services.clock().millis();
        boolean success = false;
        try {
            switch (current) {
                case EMERGE -> emerge();
                case ADAPT -> adapt();
                case INTEGRATE -> integrate();
            }
            success = true;
        } catch (RuntimeException e) {
            if (getPhase() != CognitivePhase.ADAPT) {
                transition(CognitivePhase.ADAPT);
            }
            throw e;
        } finally {
            services.metrics().recordPhase(current.name(), success, services.clock().millis() - start);
            MdcContext.clear();
        }
        restamp();
    }

    private void emerge() {
        EmergenceResult result;
        try {
            result = emergence.attemptClosure(this);
        } catch (RuntimeException e) {
            result = EmergenceResult.failure(e.getMessage() != null ? e.getMessage() : "Unknown emergence error");
        }
        if (!result.success()) {
            recordFailure(CognitivePhase.EMERGE, result.detail());
            transition(CognitivePhase.ADAPT);
            log.info("[{}] FAILURE in EMERGE: {}", id, result.detail());
            throw new EmergenceFailureException(result.detail());
        }
        log.debug("[{}] SUCCESS in EMERGE: {}", id, result.detail());
        emit("agent.emerge.succeeded", Map.of("result", result.detail()));
    }

    private void adapt() {
        List<FailureRecord> recent = recentFailures();
        FailureAnalysis analysis = FailureAnalyzer.analyze(recent);
        ContextThread thread = contextThread;
        DecisionFactors factors = new DecisionFactors(
                resourcesRemaining(),
                recent.size(),
                analysis.severity(),
                analysis.type(),
                thread.recursionDepth(),
                configurationProfile.maxRecursionDepthOr(services.properties().getDefaultMaxRecursionDepth()),
                Duration.between(thread.createdAt(), services.clock().instant()),
                thread.resourceBudget().maxExecutionTimeMs());
        StrategicDecision decision = decisionPolicy.decide(factors);

        services.metrics().recordStrategicDecision(decision.decision().name());
        log.info("[{}] ADAPT decision: {} - {}", id, decision.decision(), decision.reason());
        log.info("[{}] Failure analysis: {} {} ({}) - {}", id, analysis.severity(), analysis.type(),
                analysis.pattern(), analysis.recommendation());
        emit("agent.adapt.decision", Map.of(
                "decision", decision.decision().name(),
                "reason", decision.reason(),
                "severity", analysis.severity().name(),
                "type", analysis.type().name(),
                "pattern", analysis.pattern(),
                "recommendation", analysis.recommendation()));

        if (decision.proceed()) {
            adaptationContext = decision;
            transition(CognitivePhase.INTEGRATE);
            return;
        }
        halted = true;
        log.warn("[{}] FAILURE in ADAPT: Agent halted: {}", id, decision.reason());
        throw new StrategicHaltException(decision);
    }

    private void integrate() {
        consume(ResourceUsage.computeUnits(INTEGRATE_COMPUTE_UNITS));
        TacticalPlan plan;
        try {
            plan = TacticalPlanner.synthesize(adaptationContext, recentFailures(), services.clock().instant());
        } catch (TacticalPlanInvalidException e) {
            recordFailure(CognitivePhase.INTEGRATE, e.getMessage());
            throw e;
        }
        currentPlan = plan;
        adaptationContext = null;
        transition(CognitivePhase.EMERGE);
        log.info("[{}] SUCCESS in INTEGRATE: new tactical plan {} (confidence {})", id, plan.approach(),
                String.format("%.2f", plan.confidence()));
        emit("agent.integrate.planned", Map.of("approach", plan.approach(), "confidence", plan.confidence()));
    }

    // --- Hierarchical delegation ---

    /**
     * Spawns a CORE child for {@code taskDefinition}. The child's budget is the
     * profile's explicit budget, or a share of this agent's remaining budget.
     * The clone estimate is charged to this agent once the governor approves.
     *
     * @throws ApprovalDeniedException when the governor refuses; nothing is created
     */
    public CognitiveAgent clone(ConfigurationProfile childConfig, String taskDefinition) {
        Objects.requireNonNull(childConfig, "childConfig");
        Objects.requireNonNull(taskDefinition, "taskDefinition");
        requireRunnable();
        touch();
        cloneLock.lock();
        try {
            MdcContext.setAgent(id, rootAgentId);
            ContextThread parentThread = contextThread;
            ResourceBudget childBudget = childConfig.budgetOverride().orElseGet(() ->
                    getUsage().remainingWithin(parentThread.resourceBudget())
                            .scaled(services.properties().getChildBudgetRatio()));
            ContextThread childThread = ContextThread.childOf(parentThread, id, childConfig, taskDefinition,
                    childBudget, services.clock());
            ResourceUsage estimate = services.properties().getCloneEstimate().toUsage();

            ApprovalResponse approval = services.governor().requestApproval(new ApprovalRequest(
                    OperationType.CLONE_AGENT, id, estimate, childThread,
                    Map.of("childRole", AgentRole.CORE.name(), "taskDefinition", taskDefinition)));
            if (!approval.approved()) {
                ApprovalDeniedException denied = new ApprovalDeniedException(OperationType.CLONE_AGENT, approval);
                services.governor().recordDenial(id, denied.getMessage());
                throw denied;
            }

            CognitiveAgent child = new CognitiveAgent(AgentRole.CORE, childConfig, childThread, rootAgentId,
                    services);
            services.governor().registerAgent(child.getId(), childThread);
            adoptChild(child);
            consume(estimate);

            services.metrics().recordAgentLifecycle("cloned", AgentRole.CORE.name());
            services.metrics().recordChildBudget(childBudget.maxLlmCalls());
            log.info("[{}] Created child agent {} for task: {}", id, child.getId(), taskDefinition);
            emit("agent.child.created", Map.of("childId", child.getId(), "taskDefinition", taskDefinition,
                    "recursionDepth", childThread.recursionDepth()));
            return child;
        } finally {
            MdcContext.clear();
            cloneLock.unlock();
        }
    }

    void adoptChild(CognitiveAgent child) {
        children.put(child.getId(), child);
    }

    public Optional<CognitiveAgent> getChildAgent(String childId) {
        return Optional.ofNullable(children.get(childId));
    }

    public List<CognitiveAgent> listChildAgents() {
        return List.copyOf(children.values());
    }

    /**
     * Polls every child for a report. A child whose status cannot be read is
     * reported as ERROR.
     */
    public List<ChildAgentReport> getChildAgentReports() {
        List<ChildAgentReport> reports = new ArrayList<>();
        for (CognitiveAgent child : children.values()) {
            reports.add(collectReport(child));
        }
        return reports;
    }

    /**
     * Reports on, terminates and forgets one child.
     *
     * @return the child's report, or empty when no such child exists
     */
    public Optional<ChildAgentReport> removeChildAgent(String childId) {
        CognitiveAgent child = children.get(childId);
        if (child == null) {
            return Optional.empty();
        }
        try {
            ChildAgentReport report = collectReport(child);
            child.terminate();
            children.remove(childId);
            log.info("[{}] Removed child agent {}, status: {}", id, childId, report.status());
            emit("agent.child.removed", Map.of("childId", childId, "status", report.status().name()));
            return Optional.of(report);
        } catch (RuntimeException e) {
            services.governor().recordError(id, "Child agent removal failed: " + describe(e));
            throw e;
        }
    }

    // --- Termination ---

    /**
     * Marks the agent inactive, terminates every child (a failing child never
     * stops its siblings), forwards the reports to the parent and finally
     * removes this agent from the governor. Calling it again returns the
     * first summary.
     */
    public TerminationSummary terminate() {
        synchronized (terminationLock) {
            if (terminationSummary != null) {
                return terminationSummary;
            }
            active = false;
            List<ChildTermination> results = new ArrayList<>();
            for (CognitiveAgent child : List.copyOf(children.values())) {
                results.add(terminateChild(child));
            }
            children.clear();

            TerminationSummary summary = new TerminationSummary(id, results, services.clock().instant());
            String parentAgentId = contextThread.parentAgentId();
            if (parentAgentId != null) {
                reportToParent(parentAgentId, summary.reports());
            }
            services.governor().removeAgent(id);

            services.metrics().recordAgentLifecycle("terminated", role.name());
            log.info("[{}] Agent terminated with {} child reports ({} failed)", id, results.size(),
                    summary.failures().size());
            emit("agent.terminated", Map.of("childReports", results.size(),
                    "failedChildren", summary.failures().size()));
            terminationSummary = summary;
            return summary;
        }
    }

    private ChildTermination terminateChild(CognitiveAgent child) {
        ChildAgentReport report = collectReport(child);
        try {
            TerminationSummary subtree = child.terminate();
            return new ChildTermination.Ok(report, subtree);
        } catch (RuntimeException e) {
            String message = describe(e);
            log.warn("[{}] Child agent {} termination failed: {}", id, report.childId(), message, e);
            services.governor().recordError(id, "Child agent termination failed: " + message);
            return new ChildTermination.Err(report.withError(message), message);
        }
    }

    private void reportToParent(String parentAgentId, List<ChildAgentReport> reports) {
        log.info("[{}] Reporting to parent {}: {} child agent results", id, parentAgentId, reports.size());
        emit("agent.reported_to_parent", Map.of("parentAgentId", parentAgentId, "reportCount", reports.size()));
    }

    ChildAgentReport collectReport(CognitiveAgent child) {
        Instant now = services.clock().instant();
        String childId = child.getId();
        try {
            AgentStatus status = child.getStatus();
            ContextThread childThread = child.getContextThread();
            long executionTime = Duration.between(childThread.createdAt(), now).toMillis();
            ReportStatus reportStatus;
            Map<String, Object> result = null;
            String error = null;
            if (!status.active()) {
                reportStatus = ReportStatus.COMPLETED;
                result = Map.of(
                        "finalPhase", status.phase().name(),
                        "resourcesUsed", status.resourceUsage(),
                        "taskCompleted", true,
                        "summary", "Child agent completed task: " + childThread.taskDefinition());
            } else if (isStuck(status, now)) {
                reportStatus = ReportStatus.FAILED;
                error = "Child agent stuck in ADAPT phase with repeated failures";
            } else {
                reportStatus = ReportStatus.RUNNING;
            }
            return new ChildAgentReport(childId, childThread.taskDefinition(), reportStatus, result, error,
                    status.resourceUsage(), executionTime, now);
        } catch (RuntimeException e) {
            String task = null;
            long executionTime = 0;
            try {
                ContextThread childThread = child.getContextThread();
                task = childThread.taskDefinition();
                executionTime = Duration.between(childThread.createdAt(), now).toMillis();
            } catch (RuntimeException ignored) {
                // status and thread both unreadable; report what we have
            }
            return new ChildAgentReport(childId, task, ReportStatus.ERROR, null, describe(e),
                    ResourceUsage.ZERO, executionTime, now);
        }
    }

    private boolean isStuck(AgentStatus status, Instant now) {
        return status.phase() == CognitivePhase.ADAPT
                && Duration.between(status.lastActivity(), now)
                        .compareTo(services.properties().getStuckChildThreshold()) > 0;
    }

    // --- State ---

    /**
     * Pure function of this agent's current state and {@code userState}.
     */
    public RelationalDelta calculateRelationalDelta(UserState userState) {
        return RelationalDelta.between(getState(), userState);
    }

    public void updateState(AgentStateUpdate update) {
        synchronized (stateLock) {
            state = state.apply(update, services.clock().instant());
        }
        touch();
    }

    public AgentStatus getStatus() {
        synchronized (stateLock) {
            return new AgentStatus(id, phase, active, children.size(), usage, lastActivity);
        }
    }

    private void requireBudgetFor(ResourceUsage charge) {
        if (getUsage().plus(charge).exceeds(contextThread.resourceBudget())) {
            throw new ApprovalDeniedException(OperationType.LLM_CALL, ApprovalResponse.deny(
                    DenialReason.BUDGET_INSUFFICIENT, "Insufficient budget to process input"));
        }
    }

    /**
     * Adds {@code delta} to this agent's usage and reports it to the governor.
     */
    void consume(ResourceUsage delta) {
        synchronized (stateLock) {
            usage = usage.plus(delta);
        }
        services.governor().updateResourceUsage(id, delta);
    }

    /**
     * {@code clamp(0.7 - 0.1 * recentFailures + (resourcesRemaining ? 0.1 : -0.2), 0.1, 0.9)}.
     */
    double successProbability() {
        double bonus = resourcesRemaining() ? 0.1 : -0.2;
        return Math.max(0.1, Math.min(0.9, 0.7 - 0.1 * recentFailures().size() + bonus));
    }

    boolean resourcesRemaining() {
        return getUsage().hasHeadroomWithin(contextThread.resourceBudget());
    }

    List<FailureRecord> recentFailures() {
        Instant cutoff = services.clock().instant().minus(services.properties().getFailureWindow());
        synchronized (stateLock) {
            return failures.stream().filter(f -> f.timestamp().isAfter(cutoff)).toList();
        }
    }

    private void recordFailure(CognitivePhase failedPhase, String error) {
        synchronized (stateLock) {
            failures.add(new FailureRecord(failedPhase, error, services.clock().instant()));
        }
    }

    private void transition(CognitivePhase next) {
        CognitivePhase previous;
        synchronized (stateLock) {
            previous = phase;
            phase = next;
            state = state.withPhase(next, services.clock().instant());
        }
        if (previous != next) {
            log.debug("[{}] Phase {} -> {}", id, previous, next);
            emit("agent.phase.changed", Map.of("from", previous.name(), "to", next.name()));
        }
    }

    private void restamp() {
        synchronized (stateLock) {
            state = state.withPhase(phase, services.clock().instant());
        }
        contextThread = contextThread.touch(services.clock());
    }

    private void touch() {
        lastActivity = services.clock().instant();
    }

    private void requireRunnable() {
        if (halted) {
            throw new AgentHaltedException(id, "Agent " + id + " has halted and accepts no further work");
        }
        if (!active) {
            throw new AgentHaltedException(id, "Agent " + id + " has been terminated");
        }
    }

    private void emit(String eventType, Map<String, Object> detail) {
        services.eventBus().publish(new AgentEvent(eventType, id, detail, services.clock().instant()));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // --- Accessors ---

    public String getId() {
        return id;
    }

    public AgentRole getRole() {
        return role;
    }

    public ConfigurationProfile getConfigurationProfile() {
        return configurationProfile;
    }

    public ContextThread getContextThread() {
        return contextThread;
    }

    public String getParentAgentId() {
        return contextThread.parentAgentId();
    }

    public String getRootAgentId() {
        return rootAgentId;
    }

    public CognitivePhase getPhase() {
        synchronized (stateLock) {
            return phase;
        }
    }

    public AgentState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    public ResourceUsage getUsage() {
        synchronized (stateLock) {
            return usage;
        }
    }

    public boolean isActive() {
        return active;
    }

    public boolean isHalted() {
        return halted;
    }

    public Optional<TacticalPlan> getCurrentPlan() {
        return Optional.ofNullable(currentPlan);
    }

    public List<FailureRecord> getFailureHistory() {
        synchronized (stateLock) {
            return List.copyOf(failures);
        }
    }

    AgentServices services() {
        return services;
    }
}
