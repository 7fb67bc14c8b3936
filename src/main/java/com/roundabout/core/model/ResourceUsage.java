package com.roundabout.core.model;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Cumulative (or incremental) resource consumption, shaped like a
 * {@link ResourceBudget}. Fields are never negative, so adding usage can only
 * grow a ledger entry.
 *
 * @param llmCalls        model invocations
 * @param computeUnits    abstract compute units
 * @param storageBytes    storage in bytes
 * @param executionTimeMs execution time in milliseconds
 */
public record ResourceUsage(
    long llmCalls,
    long computeUnits,
    long storageBytes,
    long executionTimeMs
) implements Serializable {

    public static final ResourceUsage ZERO = new ResourceUsage(0, 0, 0, 0);

    public ResourceUsage {
        if (llmCalls < 0 || computeUnits < 0 || storageBytes < 0 || executionTimeMs < 0) {
            throw new IllegalArgumentException("Resource usage fields must be non-negative: "
                    + llmCalls + "/" + computeUnits + "/" + storageBytes + "/" + executionTimeMs);
        }
    }

    public static ResourceUsage llmCalls(long calls) {
        return new ResourceUsage(calls, 0, 0, 0);
    }

    public static ResourceUsage computeUnits(long units) {
        return new ResourceUsage(0, units, 0, 0);
    }

    public ResourceUsage plus(ResourceUsage other) {
        return new ResourceUsage(
                Math.addExact(llmCalls, other.llmCalls),
                Math.addExact(computeUnits, other.computeUnits),
                Math.addExact(storageBytes, other.storageBytes),
                Math.addExact(executionTimeMs, other.executionTimeMs));
    }

    /**
     * Budget minus this usage, floored at zero per dimension.
     */
    public ResourceBudget remainingWithin(ResourceBudget budget) {
        return new ResourceBudget(
                Math.max(0, budget.maxLlmCalls() - llmCalls),
                Math.max(0, budget.maxComputeUnits() - computeUnits),
                Math.max(0, budget.maxStorageBytes() - storageBytes),
                Math.max(0, budget.maxExecutionTimeMs() - executionTimeMs));
    }

    /**
     * True when any dimension is strictly above the budget.
     */
    public boolean exceeds(ResourceBudget budget) {
        return llmCalls > budget.maxLlmCalls()
                || computeUnits > budget.maxComputeUnits()
                || storageBytes > budget.maxStorageBytes()
                || executionTimeMs > budget.maxExecutionTimeMs();
    }

    /**
     * True when any dimension is strictly above {@code ratio} times the budget.
     */
    public boolean exceedsFraction(ResourceBudget budget, double ratio) {
        BigDecimal factor = BigDecimal.valueOf(ratio);
        return above(llmCalls, budget.maxLlmCalls(), factor)
                || above(computeUnits, budget.maxComputeUnits(), factor)
                || above(storageBytes, budget.maxStorageBytes(), factor)
                || above(executionTimeMs, budget.maxExecutionTimeMs(), factor);
    }

    /**
     * True while LLM calls, compute and storage are all strictly below the budget.
     * Execution time is governed by the elapsed-time rule instead.
     */
    public boolean hasHeadroomWithin(ResourceBudget budget) {
        return llmCalls < budget.maxLlmCalls()
                && computeUnits < budget.maxComputeUnits()
                && storageBytes < budget.maxStorageBytes();
    }

    /**
     * Weighted cost used for spike detection: compute units plus ten per LLM call.
     */
    public long weightedCost() {
        return computeUnits + 10 * llmCalls;
    }

    private static boolean above(long used, long limit, BigDecimal factor) {
        return BigDecimal.valueOf(used).compareTo(factor.multiply(BigDecimal.valueOf(limit))) > 0;
    }
}
