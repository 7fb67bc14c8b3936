package com.roundabout.core.governor;

import java.util.List;

/**
 * Outcome of a user quota check. Lists every violated limit so callers can
 * report specifics rather than a bare boolean.
 */
public record QuotaCheckResult(boolean withinLimits, List<String> violations) {

    public QuotaCheckResult {
        violations = List.copyOf(violations);
    }

    public static QuotaCheckResult of(List<String> violations) {
        return new QuotaCheckResult(violations.isEmpty(), violations);
    }
}
