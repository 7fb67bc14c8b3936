package com.roundabout.core.agent;

import com.roundabout.core.model.ChildAgentReport;

/**
 * Result of terminating one child: the child's report plus either its own
 * subtree summary or the error that interrupted its termination.
 */
public sealed interface ChildTermination {

    ChildAgentReport report();

    record Ok(ChildAgentReport report, TerminationSummary subtree) implements ChildTermination {
    }

    record Err(ChildAgentReport report, String error) implements ChildTermination {
    }
}
