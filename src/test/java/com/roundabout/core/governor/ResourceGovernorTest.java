package com.roundabout.core.governor;

import com.roundabout.core.events.AgentEvent;
import com.roundabout.core.model.ConfigurationProfile;
import com.roundabout.core.model.ContextThread;
import com.roundabout.core.model.ResourceBudget;
import com.roundabout.core.model.ResourceUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ResourceGovernor} wired over real collaborators and a manual clock.
 */
class ResourceGovernorTest {

    private static final ResourceBudget BUDGET = new ResourceBudget(10, 100, 1024 * 1024, 30_000);
    private static final ResourceUsage CLONE_ESTIMATE = new ResourceUsage(4, 20, 256, 10_000);

    private GovernorFixture fixture;
    private ResourceGovernor governor;

    @BeforeEach
    void setUp() {
        fixture = new GovernorFixture();
        governor = fixture.governor;
    }

    private GovernorFixture withProperties(java.util.function.Consumer<GovernorProperties> customizer) {
        GovernorProperties properties = new GovernorProperties();
        customizer.accept(properties);
        fixture = new GovernorFixture(properties);
        governor = fixture.governor;
        return fixture;
    }

    private ContextThread thread(String parentAgentId, int depth, ResourceBudget budget) {
        ConfigurationProfile profile = ConfigurationProfile.of("gpt-4o-mini", "user:alice");
        var now = fixture.time.instant();
        return new ContextThread("thread-" + depth + "-" + parentAgentId, "goal", parentAgentId, "task",
                profile, profile.memoryScope(), budget, depth, "main", now, now);
    }

    private ApprovalRequest cloneRequest(String agentId, ContextThread childThread) {
        return new ApprovalRequest(OperationType.CLONE_AGENT, agentId, CLONE_ESTIMATE, childThread);
    }

    private ApprovalRequest llmCall(String agentId, ContextThread thread) {
        return new ApprovalRequest(OperationType.LLM_CALL, agentId, ResourceUsage.llmCalls(1), thread);
    }

    @Nested
    @DisplayName("check order")
    class CheckOrder {

        @Test
        @DisplayName("a paused hierarchy is reported before an open breaker")
        void pauseBeforeBreaker() {
            governor.registerAgent("root", thread(null, 0, BUDGET));
            governor.pauseAgentHierarchy("root", "maintenance");
            governor.setCircuitBreakerState(CircuitBreakerStatus.OPEN);

            var response = governor.requestApproval(llmCall("root", thread(null, 0, BUDGET)));

            assertFalse(response.approved());
            assertEquals(DenialReason.HIERARCHY_PAUSED, response.denial());
            assertTrue(response.reason().contains("maintenance"));
        }

        @Test
        @DisplayName("an open breaker is reported before Sleep tempo")
        void breakerBeforeTempo() {
            governor.setCircuitBreakerState(CircuitBreakerStatus.OPEN);
            governor.setSystemTempo(SystemTempo.SLEEP);

            var response = governor.requestApproval(llmCall("a", thread(null, 0, BUDGET)));

            assertEquals(DenialReason.CIRCUIT_BREAKER_OPEN, response.denial());
        }

        @Test
        @DisplayName("Sleep tempo is reported before operation validation")
        void tempoBeforeValidation() {
            governor.setSystemTempo(SystemTempo.SLEEP);

            var response = governor.requestApproval(cloneRequest("a", thread("a", 9, BUDGET)));

            assertEquals(DenialReason.SLEEP_TEMPO, response.denial());
        }
    }

    @Nested
    @DisplayName("tempo")
    class Tempo {

        @Test
        @DisplayName("Sleep denies external calls but allows memory access")
        void sleepAllowsOnlyMemory() {
            governor.setSystemTempo(SystemTempo.SLEEP);
            var t = thread(null, 0, BUDGET);

            var external = governor.requestApproval(
                    new ApprovalRequest(OperationType.EXTERNAL_API, "a", ResourceUsage.ZERO, t));
            var memory = governor.requestApproval(
                    new ApprovalRequest(OperationType.MEMORY_ACCESS, "a", ResourceUsage.ZERO, t));

            assertEquals(DenialReason.SLEEP_TEMPO, external.denial());
            assertTrue(memory.approved());
        }

        @Test
        @DisplayName("Low-Intensity halves the clone estimate before validation")
        void lowIntensityHalvesEstimate() {
            governor.registerAgent("root", thread(null, 0, BUDGET));
            governor.setSystemTempo(SystemTempo.LOW_INTENSITY);

            var response = governor.requestApproval(cloneRequest("root", thread("root", 1, BUDGET.scaled(0.3))));

            assertTrue(response.approved());
            assertEquals(new ResourceUsage(2, 10, 256, 10_000), response.updatedBudget());
        }
    }

    @Nested
    @DisplayName("clone validation")
    class CloneValidation {

        @Test
        @DisplayName("a child at the maximum depth is refused, one level above is allowed")
        void recursionLimit() {
            governor.registerAgent("parent", thread("grandparent", 4, BUDGET));

            var atMax = governor.requestApproval(cloneRequest("parent", thread("parent", 5, BUDGET)));
            var belowMax = governor.requestApproval(cloneRequest("parent", thread("parent", 4, BUDGET)));

            assertEquals(DenialReason.RECURSION_LIMIT_EXCEEDED, atMax.denial());
            assertEquals("Maximum recursion depth (5) exceeded", atMax.reason());
            assertTrue(belowMax.approved());
        }

        @Test
        @DisplayName("system agent cap")
        void systemCap() {
            withProperties(p -> p.setMaxSystemAgents(2));
            governor.registerAgent("a", thread(null, 0, BUDGET));
            governor.registerAgent("b", thread(null, 0, BUDGET));

            var response = governor.requestApproval(cloneRequest("a", thread("a", 1, BUDGET)));

            assertEquals(DenialReason.SYSTEM_AGENT_CAP_EXCEEDED, response.denial());
        }

        @Test
        @DisplayName("per-user agent cap")
        void userCap() {
            withProperties(p -> p.setMaxActiveAgentsPerUser(1));
            governor.registerAgent("a", thread(null, 0, BUDGET));

            var response = governor.requestApproval(cloneRequest("a", thread("a", 1, BUDGET)));

            assertEquals(DenialReason.USER_AGENT_CAP_EXCEEDED, response.denial());
            assertTrue(response.reason().endsWith("for alice"));
        }

        @Test
        @DisplayName("projected usage strictly above 90% of the parent budget is refused")
        void budgetThreshold() {
            governor.registerAgent("root", thread(null, 0, BUDGET));
            governor.updateResourceUsage("root", ResourceUsage.llmCalls(5));

            var atThreshold = governor.requestApproval(cloneRequest("root", thread("root", 1, BUDGET)));
            governor.updateResourceUsage("root", ResourceUsage.llmCalls(1));
            var overThreshold = governor.requestApproval(cloneRequest("root", thread("root", 1, BUDGET)));

            assertTrue(atThreshold.approved());
            assertEquals(9, atThreshold.updatedBudget().llmCalls());
            assertEquals(DenialReason.BUDGET_INSUFFICIENT, overThreshold.denial());
            assertEquals("Insufficient resource budget for agent cloning", overThreshold.reason());
        }
    }

    @Nested
    @DisplayName("LLM call validation")
    class LlmValidation {

        @Test
        @DisplayName("projected usage over the thread budget is refused")
        void overThreadBudget() {
            var t = thread(null, 0, BUDGET);
            governor.registerAgent("a", t);
            governor.updateResourceUsage("a", ResourceUsage.llmCalls(10));

            var response = governor.requestApproval(llmCall("a", t));

            assertEquals(DenialReason.BUDGET_INSUFFICIENT, response.denial());
            assertEquals("LLM call quota exceeded", response.reason());
        }

        @Test
        @DisplayName("a zero estimate still counts as one call")
        void zeroEstimateCountsOne() {
            var t = thread(null, 0, BUDGET);
            governor.registerAgent("a", t);

            var response = governor.requestApproval(
                    new ApprovalRequest(OperationType.LLM_CALL, "a", ResourceUsage.ZERO, t));

            assertEquals(1, response.updatedBudget().llmCalls());
        }

        @Test
        @DisplayName("requested tokens above the per-call quota are a violation")
        void tokensPerCall() {
            var t = thread(null, 0, BUDGET);
            governor.registerAgent("a", t);

            var response = governor.requestApproval(new ApprovalRequest(OperationType.LLM_CALL, "a",
                    ResourceUsage.llmCalls(1), t, Map.of(ApprovalRequest.PARAM_MAX_TOKENS, 5000)));

            assertEquals(DenialReason.QUOTA_VIOLATION, response.denial());
            assertEquals(List.of("Tokens per call exceeded: 5000/4000"), response.violations());
        }

        @Test
        @DisplayName("hourly user quota violations deny the call")
        void hourlyQuota() {
            var big = new ResourceBudget(1000, 1000, 1024, 100_000);
            var t = thread(null, 0, big);
            governor.registerAgent("a", t);
            var free = governor.getUserQuotas("alice");
            governor.setUserQuotas("alice", new UserResourceQuotas("ignored", QuotaTier.FREE,
                    new UserResourceQuotas.LlmQuota(2, 200, 4000), free.storageQuota(), free.computeQuota()));
            governor.updateResourceUsage("a", ResourceUsage.llmCalls(3));

            var response = governor.requestApproval(llmCall("a", t));

            assertEquals(DenialReason.QUOTA_VIOLATION, response.denial());
            assertEquals(List.of("LLM calls per hour exceeded: 3/2"), response.violations());
        }

        @Test
        @DisplayName("hourly usage ages out of the hourly window")
        void hourlyWindowAgesOut() {
            var big = new ResourceBudget(1000, 1000, 1024, 100_000);
            var t = thread(null, 0, big);
            governor.registerAgent("a", t);
            var free = governor.getUserQuotas("alice");
            governor.setUserQuotas("alice", new UserResourceQuotas("alice", QuotaTier.FREE,
                    new UserResourceQuotas.LlmQuota(2, 200, 4000), free.storageQuota(), free.computeQuota()));
            governor.updateResourceUsage("a", ResourceUsage.llmCalls(3));
            fixture.time.advance(Duration.ofMinutes(61));

            assertTrue(governor.checkUserQuotas("alice").withinLimits());
        }
    }

    @Nested
    @DisplayName("charging only what was approved")
    class BudgetBound {

        @ParameterizedTest(name = "seed {0}")
        @ValueSource(longs = {1L, 7L, 42L, 2024L, 90210L})
        @DisplayName("usage never exceeds the thread budget over random estimate sequences")
        void usageStaysWithinBudget(long seed) {
            // keep tempo at High-Performance so approvals validate the raw estimate
            withProperties(p -> p.getCircuitBreaker().setBaselineCost(1_000_000));
            var budget = new ResourceBudget(20, 200, 4096, 30_000);
            var t = thread(null, 0, budget);
            governor.registerAgent("a", t);
            Random random = new Random(seed);

            int approvals = 0;
            for (int i = 0; i < 200; i++) {
                var estimate = new ResourceUsage(1 + random.nextInt(5), random.nextInt(60),
                        random.nextInt(1500), random.nextInt(8000));
                var response = governor.requestApproval(new ApprovalRequest(OperationType.LLM_CALL, "a", estimate, t));
                if (response.approved()) {
                    approvals++;
                    governor.updateResourceUsage("a", estimate);
                    assertEquals(response.updatedBudget(), governor.getUsage("a"));
                } else {
                    assertEquals(DenialReason.BUDGET_INSUFFICIENT, response.denial());
                }
                assertFalse(governor.getUsage("a").exceeds(budget), "usage exceeded budget at step " + i);
            }
            assertTrue(approvals > 0);
        }
    }

    @Test
    @DisplayName("autonomous mode is not supported")
    void autonomousUnsupported() {
        var response = governor.requestApproval(
                new ApprovalRequest(OperationType.AUTONOMOUS_MODE, "a", ResourceUsage.ZERO, thread(null, 0, BUDGET)));

        assertEquals(DenialReason.UNSUPPORTED_OPERATION, response.denial());
        assertEquals(DenialReason.Category.STRUCTURAL, response.denial().category());
    }

    @Nested
    @DisplayName("circuit breaker signals")
    class BreakerSignals {

        @Test
        @DisplayName("five errors at rate 0.5 stay under the default threshold")
        void defaultThresholdHolds() {
            for (int i = 0; i < 5; i++) {
                governor.recordError("a", "boom");
            }
            assertEquals(CircuitBreakerStatus.CLOSED, governor.getCircuitBreakerStatus());
        }

        @Test
        @DisplayName("fewer than five errors never open the breaker")
        void minimumSamples() {
            withProperties(p -> p.getCircuitBreaker().setErrorRateThreshold(0.3));
            for (int i = 0; i < 4; i++) {
                governor.recordError("a", "boom");
            }
            assertEquals(CircuitBreakerStatus.CLOSED, governor.getCircuitBreakerStatus());
        }

        @Test
        @DisplayName("error rate scales with active agents")
        void rateScalesWithAgents() {
            withProperties(p -> p.getCircuitBreaker().setErrorRateThreshold(0.3));
            for (int i = 0; i < 10; i++) {
                governor.registerAgent("agent-" + i, thread(null, 0, BUDGET));
            }
            for (int i = 0; i < 5; i++) {
                governor.recordError("agent-0", "boom");
            }
            assertEquals(CircuitBreakerStatus.CLOSED, governor.getCircuitBreakerStatus());
            assertEquals(0.05, governor.getSystemMetrics().circuitBreakerInfo().errorRate(), 1e-9);
        }

        @Test
        @DisplayName("errors open the breaker, cooldown half-opens it, three approvals close it")
        void fullBreakerCycle() {
            withProperties(p -> p.getCircuitBreaker().setErrorRateThreshold(0.3));
            var t = thread(null, 0, BUDGET);

            for (int i = 0; i < 5; i++) {
                governor.recordError("a", "boom");
            }
            assertEquals(CircuitBreakerStatus.OPEN, governor.getCircuitBreakerStatus());
            assertEquals(DenialReason.CIRCUIT_BREAKER_OPEN,
                    governor.requestApproval(llmCall("a", t)).denial());

            fixture.time.advance(Duration.ofMinutes(5));
            assertEquals(CircuitBreakerStatus.HALF_OPEN, governor.getCircuitBreakerStatus());

            for (int i = 0; i < 3; i++) {
                assertTrue(governor.requestApproval(
                        new ApprovalRequest(OperationType.MEMORY_ACCESS, "a", ResourceUsage.ZERO, t)).approved());
            }
            assertEquals(CircuitBreakerStatus.CLOSED, governor.getCircuitBreakerStatus());
        }

        @Test
        @DisplayName("any error while half-open re-opens the breaker")
        void errorWhileHalfOpen() {
            governor.setCircuitBreakerState(CircuitBreakerStatus.HALF_OPEN);
            governor.recordError("a", "boom");
            assertEquals(CircuitBreakerStatus.OPEN, governor.getCircuitBreakerStatus());
        }

        @Test
        @DisplayName("a denial recorded while half-open leaves the breaker half-open")
        void denialWhileHalfOpen() {
            governor.setCircuitBreakerState(CircuitBreakerStatus.HALF_OPEN);

            governor.recordDenial("a", "Agent cloning denied: Insufficient resource budget for agent cloning");

            assertEquals(CircuitBreakerStatus.HALF_OPEN, governor.getCircuitBreakerStatus());
            assertEquals(1, governor.getSystemMetrics().errorHistory().size());
        }

        @Test
        @DisplayName("denials still count toward the error rate while closed")
        void denialsCountWhileClosed() {
            withProperties(p -> p.getCircuitBreaker().setErrorRateThreshold(0.3));
            for (int i = 0; i < 5; i++) {
                governor.recordDenial("a", "denied");
            }
            assertEquals(CircuitBreakerStatus.OPEN, governor.getCircuitBreakerStatus());
        }

        @Test
        @DisplayName("a cost spike on cumulative usage opens the breaker and pauses the offender's root once")
        void costSpikePausesRoot() {
            governor.registerAgent("root", thread(null, 0, BUDGET));
            governor.registerAgent("child", thread("root", 1, BUDGET));

            // cumulative costs 400, 800, ... 2000: five samples are not enough
            for (int i = 0; i < 5; i++) {
                governor.updateResourceUsage("child", ResourceUsage.computeUnits(400));
            }
            assertEquals(CircuitBreakerStatus.CLOSED, governor.getCircuitBreakerStatus());

            // sixth sample: average 1400, spike 14
            governor.updateResourceUsage("child", ResourceUsage.computeUnits(400));
            assertEquals(CircuitBreakerStatus.OPEN, governor.getCircuitBreakerStatus());
            assertTrue(governor.isHierarchyPaused("root"));
            assertFalse(governor.isHierarchyPaused("child"));
            assertEquals(14.0, governor.getSystemMetrics().circuitBreakerInfo().costSpike(), 1e-9);

            governor.resumeAgentHierarchy("root");
            governor.updateResourceUsage("child", ResourceUsage.computeUnits(400));
            assertFalse(governor.isHierarchyPaused("root"));
        }

        @Test
        @DisplayName("small per-update deltas never spike while cumulative usage stays low")
        void smallCumulativeUsageNeverSpikes() {
            governor.registerAgent("a", thread(null, 0, BUDGET));
            for (int i = 0; i < 20; i++) {
                governor.updateResourceUsage("a", ResourceUsage.computeUnits(5));
            }
            assertEquals(CircuitBreakerStatus.CLOSED, governor.getCircuitBreakerStatus());
        }

        @Test
        @DisplayName("threads racing on a cost spike open the breaker and pause the root exactly once")
        void concurrentCostSpikeFiresOnce() throws Exception {
            governor.registerAgent("root", thread(null, 0, BUDGET));
            int workers = 8;
            for (int i = 0; i < workers; i++) {
                governor.registerAgent("child-" + i, thread("root", 1, BUDGET));
            }
            for (int i = 0; i < workers; i++) {
                governor.updateResourceUsage("child-" + i, ResourceUsage.computeUnits(100));
            }
            List<AgentEvent> opened = new CopyOnWriteArrayList<>();
            List<AgentEvent> paused = new CopyOnWriteArrayList<>();
            fixture.eventBus.subscribeAll(e -> {
                if (e.eventType().equals("governor.breaker.open")) {
                    opened.add(e);
                } else if (e.eventType().equals("governor.hierarchy.paused")) {
                    paused.add(e);
                }
            });

            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(workers);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < workers; i++) {
                    String agentId = "child-" + i;
                    futures.add(pool.submit(() -> {
                        start.await();
                        governor.updateResourceUsage(agentId, ResourceUsage.computeUnits(5000));
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(CircuitBreakerStatus.OPEN, governor.getCircuitBreakerStatus());
            assertEquals(1, opened.size());
            assertEquals(1, paused.size());
            assertEquals("root", paused.get(0).agentId());
        }
    }

    @Nested
    @DisplayName("hierarchy pause")
    class HierarchyPause {

        @Test
        @DisplayName("pausing a root denies its descendants until resumed")
        void pauseDeniesDescendants() {
            var childThread = thread("root", 1, BUDGET);
            governor.registerAgent("root", thread(null, 0, BUDGET));
            governor.registerAgent("child", childThread);

            governor.pauseAgentHierarchy("root", "operator");
            assertEquals(DenialReason.HIERARCHY_PAUSED,
                    governor.requestApproval(llmCall("child", childThread)).denial());

            governor.resumeAgentHierarchy("root");
            assertTrue(governor.requestApproval(llmCall("child", childThread)).approved());
        }

        @Test
        @DisplayName("an unregistered requester is checked through its thread's parent")
        void unregisteredRequesterUsesThreadParent() {
            governor.registerAgent("root", thread(null, 0, BUDGET));
            governor.pauseAgentHierarchy("root", "operator");

            var response = governor.requestApproval(cloneRequest("stranger", thread("root", 1, BUDGET)));

            assertEquals(DenialReason.HIERARCHY_PAUSED, response.denial());
        }

        @Test
        @DisplayName("rootOf walks the registered parent chain")
        void rootOf() {
            governor.registerAgent("root", thread(null, 0, BUDGET));
            governor.registerAgent("child", thread("root", 1, BUDGET));
            governor.registerAgent("grandchild", thread("child", 2, BUDGET));

            assertEquals("root", governor.rootOf("grandchild"));
            assertEquals("unknown", governor.rootOf("unknown"));
        }
    }

    @Nested
    @DisplayName("registry and snapshots")
    class Registry {

        @Test
        @DisplayName("checkResourceLimits is true without an entry and false once over budget")
        void resourceLimits() {
            var t = thread(null, 0, BUDGET);
            governor.registerAgent("a", t);
            assertTrue(governor.checkResourceLimits("a", t));
            governor.updateResourceUsage("a", ResourceUsage.llmCalls(10));
            assertTrue(governor.checkResourceLimits("a", t));
            governor.updateResourceUsage("a", ResourceUsage.llmCalls(1));
            assertFalse(governor.checkResourceLimits("a", t));
        }

        @Test
        @DisplayName("removeAgent clears usage and the active count")
        void removeAgent() {
            governor.registerAgent("a", thread(null, 0, BUDGET));
            governor.updateResourceUsage("a", ResourceUsage.llmCalls(2));
            assertEquals(1, governor.getSystemStatus().activeAgents());

            governor.removeAgent("a");

            assertEquals(ResourceUsage.ZERO, governor.getUsage("a"));
            assertEquals(0, governor.getSystemStatus().activeAgents());
        }

        @Test
        @DisplayName("usage reported after removal does not bring the agent back")
        void lateUsageAfterRemovalIgnored() {
            governor.registerAgent("a", thread(null, 0, BUDGET));
            governor.removeAgent("a");

            governor.updateResourceUsage("a", ResourceUsage.llmCalls(2));

            assertEquals(ResourceUsage.ZERO, governor.getUsage("a"));
            assertEquals(0, governor.getSystemStatus().activeAgents());
        }

        @Test
        @DisplayName("system metrics expose tempo, breaker, errors and paused hierarchies")
        void systemMetrics() {
            governor.registerAgent("root", thread(null, 0, BUDGET));
            governor.recordError("root", "boom");
            governor.pauseAgentHierarchy("root", "operator");

            SystemMetrics metrics = governor.getSystemMetrics();

            assertEquals(1, metrics.activeAgents());
            assertEquals(SystemTempo.HIGH_PERFORMANCE, metrics.systemTempo());
            assertEquals(CircuitBreakerStatus.CLOSED, metrics.circuitBreakerInfo().status());
            assertEquals(1, metrics.errorHistory().size());
            assertEquals("boom", metrics.errorHistory().get(0).error());
            assertEquals(java.util.Set.of("root"), metrics.pausedHierarchies());
        }

        @Test
        @DisplayName("users start on the free tier and overrides are stamped with the user id")
        void quotas() {
            assertEquals(QuotaTier.FREE, governor.getUserQuotas("bob").tier());
            var enterprise = fixture.properties.getQuotas().getEnterprise().toQuotas("x", QuotaTier.ENTERPRISE);
            governor.setUserQuotas("bob", enterprise);
            assertEquals("bob", governor.getUserQuotas("bob").userId());
            assertEquals(QuotaTier.ENTERPRISE, governor.getUserQuotas("bob").tier());
        }
    }

    @Test
    @DisplayName("decisions are published and counted")
    void decisionsPublished() {
        List<AgentEvent> events = new ArrayList<>();
        fixture.eventBus.subscribeAll(events::add);
        governor.setSystemTempo(SystemTempo.SLEEP);

        governor.requestApproval(llmCall("a", thread(null, 0, BUDGET)));

        var denied = events.stream().filter(e -> e.eventType().equals("governor.approval.denied")).findFirst();
        assertTrue(denied.isPresent());
        assertEquals("SLEEP_TEMPO", denied.get().detail().get("denial"));
        var counter = fixture.registry.find("roundabout.governor.approvals")
                .tag("operation", "llm_call").tag("result", "denied").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
