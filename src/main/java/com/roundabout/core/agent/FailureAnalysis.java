package com.roundabout.core.agent;

/**
 * @param severity       scaled by the number of recent failures
 * @param type           inferred from the latest failure's message
 * @param pattern        "none", "isolated", "recurring-&lt;phase&gt;" or "mixed-phase"
 * @param recommendation suggested remedy for the severity/type pair
 */
public record FailureAnalysis(
    FailureSeverity severity,
    FailureType type,
    String pattern,
    String recommendation
) {
}
