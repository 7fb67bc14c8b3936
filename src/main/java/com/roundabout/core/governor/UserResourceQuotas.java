package com.roundabout.core.governor;

import java.io.Serializable;

/**
 * Per-user quota configuration. Defaulted from the tier baseline on first
 * access and overridable through {@link ResourceGovernor#setUserQuotas}.
 */
public record UserResourceQuotas(
    String userId,
    QuotaTier tier,
    LlmQuota llmQuota,
    StorageQuota storageQuota,
    ComputeQuota computeQuota
) implements Serializable {

    public record LlmQuota(long maxCallsPerHour, long maxCallsPerDay, long maxTokensPerCall) implements Serializable {
    }

    public record StorageQuota(long maxTotalBytes, long maxFileSize) implements Serializable {
    }

    public record ComputeQuota(long maxUnitsPerHour, long maxUnitsPerDay, int maxConcurrentOperations)
            implements Serializable {
    }

    public UserResourceQuotas withUserId(String id) {
        return new UserResourceQuotas(id, tier, llmQuota, storageQuota, computeQuota);
    }
}
