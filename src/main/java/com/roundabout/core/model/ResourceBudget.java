package com.roundabout.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Resource ceiling for a context thread. A budget is a limit, never a balance:
 * consumption is tracked separately as {@link ResourceUsage}.
 *
 * @param maxLlmCalls        maximum model invocations
 * @param maxComputeUnits    maximum abstract compute units
 * @param maxStorageBytes    maximum storage in bytes
 * @param maxExecutionTimeMs maximum wall-clock execution time in milliseconds
 */
public record ResourceBudget(
    long maxLlmCalls,
    long maxComputeUnits,
    long maxStorageBytes,
    long maxExecutionTimeMs
) implements Serializable {

    public static final ResourceBudget ZERO = new ResourceBudget(0, 0, 0, 0);

    public ResourceBudget {
        if (maxLlmCalls < 0 || maxComputeUnits < 0 || maxStorageBytes < 0 || maxExecutionTimeMs < 0) {
            throw new IllegalArgumentException("Resource budget fields must be non-negative: "
                    + maxLlmCalls + "/" + maxComputeUnits + "/" + maxStorageBytes + "/" + maxExecutionTimeMs);
        }
    }

    /**
     * Returns {@code floor(ratio * field)} for every dimension. Uses decimal
     * arithmetic so that e.g. {@code 0.3 * 10} is exactly 3.
     */
    public ResourceBudget scaled(double ratio) {
        if (ratio < 0) {
            throw new IllegalArgumentException("ratio must be non-negative: " + ratio);
        }
        BigDecimal factor = BigDecimal.valueOf(ratio);
        return new ResourceBudget(
                floorScale(maxLlmCalls, factor),
                floorScale(maxComputeUnits, factor),
                floorScale(maxStorageBytes, factor),
                floorScale(maxExecutionTimeMs, factor));
    }

    private static long floorScale(long value, BigDecimal factor) {
        return factor.multiply(BigDecimal.valueOf(value)).setScale(0, RoundingMode.FLOOR).longValueExact();
    }
}
