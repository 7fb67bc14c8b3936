package com.roundabout.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Report a parent collects from a child, on termination or on demand.
 *
 * @param childId         the child agent
 * @param taskDefinition  task the child was working on
 * @param status          status at collection time
 * @param result          summary of the child's final state when completed (nullable)
 * @param error           failure detail (nullable)
 * @param resourceUsage   the child's consumption at collection time
 * @param executionTimeMs milliseconds since the child's thread was created
 * @param timestamp       collection time
 */
public record ChildAgentReport(
    String childId,
    String taskDefinition,
    ReportStatus status,
    Map<String, Object> result,
    String error,
    ResourceUsage resourceUsage,
    long executionTimeMs,
    Instant timestamp
) implements Serializable {

    public ChildAgentReport {
        result = result == null ? null : Map.copyOf(result);
    }

    public ChildAgentReport withError(String message) {
        return new ChildAgentReport(childId, taskDefinition, ReportStatus.ERROR, null, message,
                resourceUsage, executionTimeMs, timestamp);
    }
}
