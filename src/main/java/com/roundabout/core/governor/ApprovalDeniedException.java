package com.roundabout.core.governor;

import com.roundabout.core.RoundaboutException;

import java.util.List;

/**
 * Thrown when the governor refuses an operation an agent cannot proceed
 * without. Terminal for that operation only; the agent stays alive.
 */
public class ApprovalDeniedException extends RoundaboutException {

    private final OperationType operation;
    private final DenialReason denialReason;
    private final List<String> violations;

    public ApprovalDeniedException(OperationType operation, ApprovalResponse response) {
        super(describe(operation, response));
        this.operation = operation;
        this.denialReason = response.denial();
        this.violations = response.violations();
    }

    public OperationType getOperation() {
        return operation;
    }

    public DenialReason getDenialReason() {
        return denialReason;
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String describe(OperationType operation, ApprovalResponse response) {
        String verb = operation == OperationType.CLONE_AGENT ? "Agent cloning" : "Operation " + operation.wireName();
        return verb + " denied: " + response.reason();
    }
}
