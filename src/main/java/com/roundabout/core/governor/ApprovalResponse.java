package com.roundabout.core.governor;

import com.roundabout.core.model.ResourceUsage;

import java.util.List;
import java.util.Optional;

/**
 * Governor decision for one {@link ApprovalRequest}.
 *
 * @param approved      whether the operation may proceed
 * @param reason        human-readable reason
 * @param denial        machine-readable denial reason (null when approved)
 * @param violations    quota violations behind a {@link DenialReason#QUOTA_VIOLATION}
 * @param updatedBudget projected usage of the requester if the operation proceeds (nullable)
 */
public record ApprovalResponse(
    boolean approved,
    String reason,
    DenialReason denial,
    List<String> violations,
    ResourceUsage updatedBudget
) {

    public ApprovalResponse {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ApprovalResponse approve(String reason) {
        return new ApprovalResponse(true, reason, null, List.of(), null);
    }

    public static ApprovalResponse approve(String reason, ResourceUsage projected) {
        return new ApprovalResponse(true, reason, null, List.of(), projected);
    }

    public static ApprovalResponse deny(DenialReason denial, String reason) {
        return new ApprovalResponse(false, reason, denial, List.of(), null);
    }

    public static ApprovalResponse deny(DenialReason denial, String reason, List<String> violations) {
        return new ApprovalResponse(false, reason, denial, violations, null);
    }

    public Optional<DenialReason> denialReason() {
        return Optional.ofNullable(denial);
    }
}
