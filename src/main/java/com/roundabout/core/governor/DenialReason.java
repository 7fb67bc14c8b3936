package com.roundabout.core.governor;

/**
 * Why the governor refused an operation. The category tells callers whether
 * to retry later, give up because the caller is not entitled, or give up
 * because the request can never succeed.
 */
public enum DenialReason {
    HIERARCHY_PAUSED(Category.RETRY_LATER),
    CIRCUIT_BREAKER_OPEN(Category.RETRY_LATER),
    SLEEP_TEMPO(Category.RETRY_LATER),
    RECURSION_LIMIT_EXCEEDED(Category.STRUCTURAL),
    SYSTEM_AGENT_CAP_EXCEEDED(Category.STRUCTURAL),
    USER_AGENT_CAP_EXCEEDED(Category.STRUCTURAL),
    BUDGET_INSUFFICIENT(Category.NOT_ENTITLED),
    QUOTA_VIOLATION(Category.NOT_ENTITLED),
    UNSUPPORTED_OPERATION(Category.STRUCTURAL);

    public enum Category {
        RETRY_LATER,
        NOT_ENTITLED,
        STRUCTURAL
    }

    private final Category category;

    DenialReason(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
