package com.roundabout.core.governor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "roundabout.governor")
public class GovernorProperties {

    private int maxRecursionDepth = 5;
    private int maxActiveAgentsPerUser = 10;
    private int maxSystemAgents = 100;
    /** Fraction of the parent's budget a clone may project usage up to. */
    private double cloneBudgetThreshold = 0.9;
    private Breaker circuitBreaker = new Breaker();
    private Tempo tempo = new Tempo();
    private Quotas quotas = new Quotas();

    public int getMaxRecursionDepth() { return maxRecursionDepth; }
    public void setMaxRecursionDepth(int maxRecursionDepth) { this.maxRecursionDepth = maxRecursionDepth; }
    public int getMaxActiveAgentsPerUser() { return maxActiveAgentsPerUser; }
    public void setMaxActiveAgentsPerUser(int maxActiveAgentsPerUser) { this.maxActiveAgentsPerUser = maxActiveAgentsPerUser; }
    public int getMaxSystemAgents() { return maxSystemAgents; }
    public void setMaxSystemAgents(int maxSystemAgents) { this.maxSystemAgents = maxSystemAgents; }
    public double getCloneBudgetThreshold() { return cloneBudgetThreshold; }
    public void setCloneBudgetThreshold(double cloneBudgetThreshold) { this.cloneBudgetThreshold = cloneBudgetThreshold; }
    public Breaker getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(Breaker circuitBreaker) { this.circuitBreaker = circuitBreaker; }
    public Tempo getTempo() { return tempo; }
    public void setTempo(Tempo tempo) { this.tempo = tempo; }
    public Quotas getQuotas() { return quotas; }
    public void setQuotas(Quotas quotas) { this.quotas = quotas; }

    public static class Breaker {
        private double errorRateThreshold = 0.8;
        private double costSpikeThreshold = 5.0;
        /** Sliding window for errors and costs, also the open-state cooldown. */
        private Duration timeWindow = Duration.ofMinutes(5);
        private double baselineCost = 100.0;
        private int minErrorSamples = 5;
        /** Cost samples required before a spike may trip the breaker (strictly more than). */
        private int minCostSamples = 5;
        /** Average cost required before a spike may trip the breaker (strictly more than). */
        private double minAverageCost = 1000.0;
        /** Consecutive approvals in HALF_OPEN that close the breaker. */
        private int halfOpenSuccessThreshold = 3;

        public double getErrorRateThreshold() { return errorRateThreshold; }
        public void setErrorRateThreshold(double errorRateThreshold) { this.errorRateThreshold = errorRateThreshold; }
        public double getCostSpikeThreshold() { return costSpikeThreshold; }
        public void setCostSpikeThreshold(double costSpikeThreshold) { this.costSpikeThreshold = costSpikeThreshold; }
        public Duration getTimeWindow() { return timeWindow; }
        public void setTimeWindow(Duration timeWindow) { this.timeWindow = timeWindow; }
        public double getBaselineCost() { return baselineCost; }
        public void setBaselineCost(double baselineCost) { this.baselineCost = baselineCost; }
        public int getMinErrorSamples() { return minErrorSamples; }
        public void setMinErrorSamples(int minErrorSamples) { this.minErrorSamples = minErrorSamples; }
        public int getMinCostSamples() { return minCostSamples; }
        public void setMinCostSamples(int minCostSamples) { this.minCostSamples = minCostSamples; }
        public double getMinAverageCost() { return minAverageCost; }
        public void setMinAverageCost(double minAverageCost) { this.minAverageCost = minAverageCost; }
        public int getHalfOpenSuccessThreshold() { return halfOpenSuccessThreshold; }
        public void setHalfOpenSuccessThreshold(int halfOpenSuccessThreshold) { this.halfOpenSuccessThreshold = halfOpenSuccessThreshold; }
    }

    /**
     * Hysteresis thresholds. Recovery thresholds sit below degrade thresholds
     * so the tempo does not oscillate around a single value.
     */
    public static class Tempo {
        private double errorDegradeToLowIntensity = 0.5;
        private double errorDegradeToSleep = 0.8;
        private double errorRecoverToLowIntensity = 0.1;
        private double errorRecoverToHighPerformance = 0.05;
        private double costDegradeToLowIntensity = 3.0;
        private double costDegradeToSleep = 5.0;
        private double costRecoverToLowIntensity = 1.5;
        private double costRecoverToHighPerformance = 1.2;

        public double getErrorDegradeToLowIntensity() { return errorDegradeToLowIntensity; }
        public void setErrorDegradeToLowIntensity(double v) { this.errorDegradeToLowIntensity = v; }
        public double getErrorDegradeToSleep() { return errorDegradeToSleep; }
        public void setErrorDegradeToSleep(double v) { this.errorDegradeToSleep = v; }
        public double getErrorRecoverToLowIntensity() { return errorRecoverToLowIntensity; }
        public void setErrorRecoverToLowIntensity(double v) { this.errorRecoverToLowIntensity = v; }
        public double getErrorRecoverToHighPerformance() { return errorRecoverToHighPerformance; }
        public void setErrorRecoverToHighPerformance(double v) { this.errorRecoverToHighPerformance = v; }
        public double getCostDegradeToLowIntensity() { return costDegradeToLowIntensity; }
        public void setCostDegradeToLowIntensity(double v) { this.costDegradeToLowIntensity = v; }
        public double getCostDegradeToSleep() { return costDegradeToSleep; }
        public void setCostDegradeToSleep(double v) { this.costDegradeToSleep = v; }
        public double getCostRecoverToLowIntensity() { return costRecoverToLowIntensity; }
        public void setCostRecoverToLowIntensity(double v) { this.costRecoverToLowIntensity = v; }
        public double getCostRecoverToHighPerformance() { return costRecoverToHighPerformance; }
        public void setCostRecoverToHighPerformance(double v) { this.costRecoverToHighPerformance = v; }
    }

    /**
     * Baseline quotas per tier, applied to users on first access.
     */
    public static class Quotas {
        private TierLimits free = new TierLimits(50, 200, 4000, 100L * 1024 * 1024, 10L * 1024 * 1024, 1000, 5000, 3);
        private TierLimits premium = new TierLimits(200, 1000, 8000, 1024L * 1024 * 1024, 100L * 1024 * 1024, 5000, 25000, 10);
        private TierLimits enterprise = new TierLimits(1000, 10000, 16000, 10L * 1024 * 1024 * 1024, 1024L * 1024 * 1024, 25000, 100000, 50);

        public TierLimits getFree() { return free; }
        public void setFree(TierLimits free) { this.free = free; }
        public TierLimits getPremium() { return premium; }
        public void setPremium(TierLimits premium) { this.premium = premium; }
        public TierLimits getEnterprise() { return enterprise; }
        public void setEnterprise(TierLimits enterprise) { this.enterprise = enterprise; }

        public TierLimits forTier(QuotaTier tier) {
            return switch (tier) {
                case FREE -> free;
                case PREMIUM -> premium;
                case ENTERPRISE -> enterprise;
            };
        }
    }

    public static class TierLimits {
        private long maxLlmCallsPerHour;
        private long maxLlmCallsPerDay;
        private long maxTokensPerCall;
        private long maxTotalStorageBytes;
        private long maxFileSizeBytes;
        private long maxComputeUnitsPerHour;
        private long maxComputeUnitsPerDay;
        private int maxConcurrentOperations;

        public TierLimits() {
        }

        public TierLimits(long maxLlmCallsPerHour, long maxLlmCallsPerDay, long maxTokensPerCall,
                          long maxTotalStorageBytes, long maxFileSizeBytes,
                          long maxComputeUnitsPerHour, long maxComputeUnitsPerDay, int maxConcurrentOperations) {
            this.maxLlmCallsPerHour = maxLlmCallsPerHour;
            this.maxLlmCallsPerDay = maxLlmCallsPerDay;
            this.maxTokensPerCall = maxTokensPerCall;
            this.maxTotalStorageBytes = maxTotalStorageBytes;
            this.maxFileSizeBytes = maxFileSizeBytes;
            this.maxComputeUnitsPerHour = maxComputeUnitsPerHour;
            this.maxComputeUnitsPerDay = maxComputeUnitsPerDay;
            this.maxConcurrentOperations = maxConcurrentOperations;
        }

        public UserResourceQuotas toQuotas(String userId, QuotaTier tier) {
            return new UserResourceQuotas(userId, tier,
                    new UserResourceQuotas.LlmQuota(maxLlmCallsPerHour, maxLlmCallsPerDay, maxTokensPerCall),
                    new UserResourceQuotas.StorageQuota(maxTotalStorageBytes, maxFileSizeBytes),
                    new UserResourceQuotas.ComputeQuota(maxComputeUnitsPerHour, maxComputeUnitsPerDay, maxConcurrentOperations));
        }

        public long getMaxLlmCallsPerHour() { return maxLlmCallsPerHour; }
        public void setMaxLlmCallsPerHour(long v) { this.maxLlmCallsPerHour = v; }
        public long getMaxLlmCallsPerDay() { return maxLlmCallsPerDay; }
        public void setMaxLlmCallsPerDay(long v) { this.maxLlmCallsPerDay = v; }
        public long getMaxTokensPerCall() { return maxTokensPerCall; }
        public void setMaxTokensPerCall(long v) { this.maxTokensPerCall = v; }
        public long getMaxTotalStorageBytes() { return maxTotalStorageBytes; }
        public void setMaxTotalStorageBytes(long v) { this.maxTotalStorageBytes = v; }
        public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
        public void setMaxFileSizeBytes(long v) { this.maxFileSizeBytes = v; }
        public long getMaxComputeUnitsPerHour() { return maxComputeUnitsPerHour; }
        public void setMaxComputeUnitsPerHour(long v) { this.maxComputeUnitsPerHour = v; }
        public long getMaxComputeUnitsPerDay() { return maxComputeUnitsPerDay; }
        public void setMaxComputeUnitsPerDay(long v) { this.maxComputeUnitsPerDay = v; }
        public int getMaxConcurrentOperations() { return maxConcurrentOperations; }
        public void setMaxConcurrentOperations(int v) { this.maxConcurrentOperations = v; }
    }
}
