package com.roundabout.core.model;

/**
 * Status of a child agent as seen by its parent when a report is collected.
 */
public enum ReportStatus {
    COMPLETED,
    FAILED,
    RUNNING,
    ERROR
}
