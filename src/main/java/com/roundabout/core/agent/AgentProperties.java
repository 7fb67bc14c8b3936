package com.roundabout.core.agent;

import com.roundabout.core.model.ResourceBudget;
import com.roundabout.core.model.ResourceUsage;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "roundabout.agent")
public class AgentProperties {

    /** Recursion ceiling used when a profile does not carry its own. */
    private int defaultMaxRecursionDepth = 5;
    /** Share of the parent's remaining budget handed to a child. */
    private double childBudgetRatio = 0.3;
    /** Fraction of the execution-time budget after which ADAPT halts. */
    private double haltElapsedFraction = 0.8;
    private Duration modelCallTimeout = Duration.ofSeconds(10);
    /** Failures older than this no longer count towards severity. */
    private Duration failureWindow = Duration.ofHours(1);
    /** A child idle in ADAPT for longer than this is reported as FAILED. */
    private Duration stuckChildThreshold = Duration.ofMinutes(1);
    private DefaultBudget defaultBudget = new DefaultBudget();
    private CloneEstimate cloneEstimate = new CloneEstimate();
    private Coordinator coordinator = new Coordinator();

    public int getDefaultMaxRecursionDepth() { return defaultMaxRecursionDepth; }
    public void setDefaultMaxRecursionDepth(int defaultMaxRecursionDepth) { this.defaultMaxRecursionDepth = defaultMaxRecursionDepth; }
    public double getChildBudgetRatio() { return childBudgetRatio; }
    public void setChildBudgetRatio(double childBudgetRatio) { this.childBudgetRatio = childBudgetRatio; }
    public double getHaltElapsedFraction() { return haltElapsedFraction; }
    public void setHaltElapsedFraction(double haltElapsedFraction) { this.haltElapsedFraction = haltElapsedFraction; }
    public Duration getModelCallTimeout() { return modelCallTimeout; }
    public void setModelCallTimeout(Duration modelCallTimeout) { this.modelCallTimeout = modelCallTimeout; }
    public Duration getFailureWindow() { return failureWindow; }
    public void setFailureWindow(Duration failureWindow) { this.failureWindow = failureWindow; }
    public Duration getStuckChildThreshold() { return stuckChildThreshold; }
    public void setStuckChildThreshold(Duration stuckChildThreshold) { this.stuckChildThreshold = stuckChildThreshold; }
    public DefaultBudget getDefaultBudget() { return defaultBudget; }
    public void setDefaultBudget(DefaultBudget defaultBudget) { this.defaultBudget = defaultBudget; }
    public CloneEstimate getCloneEstimate() { return cloneEstimate; }
    public void setCloneEstimate(CloneEstimate cloneEstimate) { this.cloneEstimate = cloneEstimate; }
    public Coordinator getCoordinator() { return coordinator; }
    public void setCoordinator(Coordinator coordinator) { this.coordinator = coordinator; }

    /**
     * Budget for root agents whose profile does not carry one.
     */
    public static class DefaultBudget {
        private long maxLlmCalls = 10;
        private long maxComputeUnits = 100;
        private long maxStorageBytes = 1024 * 1024;
        private long maxExecutionTimeMs = 30_000;

        public ResourceBudget toBudget() {
            return new ResourceBudget(maxLlmCalls, maxComputeUnits, maxStorageBytes, maxExecutionTimeMs);
        }

        public long getMaxLlmCalls() { return maxLlmCalls; }
        public void setMaxLlmCalls(long maxLlmCalls) { this.maxLlmCalls = maxLlmCalls; }
        public long getMaxComputeUnits() { return maxComputeUnits; }
        public void setMaxComputeUnits(long maxComputeUnits) { this.maxComputeUnits = maxComputeUnits; }
        public long getMaxStorageBytes() { return maxStorageBytes; }
        public void setMaxStorageBytes(long maxStorageBytes) { this.maxStorageBytes = maxStorageBytes; }
        public long getMaxExecutionTimeMs() { return maxExecutionTimeMs; }
        public void setMaxExecutionTimeMs(long maxExecutionTimeMs) { this.maxExecutionTimeMs = maxExecutionTimeMs; }
    }

    /**
     * Cost a parent reserves against its own usage for every clone request.
     */
    public static class CloneEstimate {
        private long llmCalls = 4;
        private long computeUnits = 20;
        private long storageBytes = 256;
        private long executionTimeMs = 10_000;

        public ResourceUsage toUsage() {
            return new ResourceUsage(llmCalls, computeUnits, storageBytes, executionTimeMs);
        }

        public long getLlmCalls() { return llmCalls; }
        public void setLlmCalls(long llmCalls) { this.llmCalls = llmCalls; }
        public long getComputeUnits() { return computeUnits; }
        public void setComputeUnits(long computeUnits) { this.computeUnits = computeUnits; }
        public long getStorageBytes() { return storageBytes; }
        public void setStorageBytes(long storageBytes) { this.storageBytes = storageBytes; }
        public long getExecutionTimeMs() { return executionTimeMs; }
        public void setExecutionTimeMs(long executionTimeMs) { this.executionTimeMs = executionTimeMs; }
    }

    public static class Coordinator {
        private int maxTokens = 150;
        private double temperature = 0.3;

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
    }
}
