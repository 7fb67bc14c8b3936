package com.roundabout.core.agent;

import com.roundabout.core.model.CognitivePhase;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies an agent's recent failure history for the ADAPT phase.
 */
public final class FailureAnalyzer {

    private static final Map<String, String> RECOMMENDATIONS = Map.ofEntries(
            Map.entry(key(FailureSeverity.MINOR, FailureType.LOGIC), "Retry with adjusted parameters"),
            Map.entry(key(FailureSeverity.MINOR, FailureType.RESOURCE), "Optimize resource usage"),
            Map.entry(key(FailureSeverity.MINOR, FailureType.EXTERNAL), "Implement retry with backoff"),
            Map.entry(key(FailureSeverity.MINOR, FailureType.TIMEOUT), "Increase timeout limits"),
            Map.entry(key(FailureSeverity.MODERATE, FailureType.LOGIC), "Revise approach strategy"),
            Map.entry(key(FailureSeverity.MODERATE, FailureType.RESOURCE), "Request additional resources"),
            Map.entry(key(FailureSeverity.MODERATE, FailureType.EXTERNAL), "Switch to alternative service"),
            Map.entry(key(FailureSeverity.MODERATE, FailureType.TIMEOUT), "Break task into smaller chunks"),
            Map.entry(key(FailureSeverity.CRITICAL, FailureType.LOGIC), "Escalate to parent agent"),
            Map.entry(key(FailureSeverity.CRITICAL, FailureType.RESOURCE), "Halt and report resource exhaustion"),
            Map.entry(key(FailureSeverity.CRITICAL, FailureType.EXTERNAL), "Activate fallback mode"),
            Map.entry(key(FailureSeverity.CRITICAL, FailureType.TIMEOUT), "Abort current approach")
    );

    private FailureAnalyzer() {}

    /**
     * @param failures recent failures, oldest first
     */
    public static FailureAnalysis analyze(List<FailureRecord> failures) {
        FailureSeverity severity = severityFor(failures.size());
        FailureType type = failures.isEmpty() ? FailureType.LOGIC
                : classify(failures.get(failures.size() - 1).error());
        return new FailureAnalysis(severity, type, pattern(failures), recommend(severity, type));
    }

    static FailureSeverity severityFor(int failureCount) {
        if (failureCount >= 3) {
            return FailureSeverity.CRITICAL;
        }
        return failureCount >= 2 ? FailureSeverity.MODERATE : FailureSeverity.MINOR;
    }

    /**
     * Keyword match on the raw message, checked in order: resource/quota,
     * timeout/time, external/API. Anything else is a logic failure.
     */
    static FailureType classify(String error) {
        if (error == null) {
            return FailureType.LOGIC;
        }
        if (error.contains("resource") || error.contains("quota")) {
            return FailureType.RESOURCE;
        }
        if (error.contains("timeout") || error.contains("time")) {
            return FailureType.TIMEOUT;
        }
        if (error.contains("external") || error.contains("API")) {
            return FailureType.EXTERNAL;
        }
        return FailureType.LOGIC;
    }

    static String pattern(List<FailureRecord> failures) {
        if (failures.isEmpty()) {
            return "none";
        }
        if (failures.size() == 1) {
            return "isolated";
        }
        Set<CognitivePhase> phases = EnumSet.noneOf(CognitivePhase.class);
        failures.forEach(f -> phases.add(f.phase()));
        return phases.size() == 1
                ? "recurring-" + failures.get(0).phase().name().toLowerCase()
                : "mixed-phase";
    }

    static String recommend(FailureSeverity severity, FailureType type) {
        return RECOMMENDATIONS.getOrDefault(key(severity, type), "Unknown recommendation");
    }

    private static String key(FailureSeverity severity, FailureType type) {
        return severity.name() + "-" + type.name();
    }
}
