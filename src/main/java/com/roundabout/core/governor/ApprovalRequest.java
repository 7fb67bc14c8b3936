package com.roundabout.core.governor;

import com.roundabout.core.model.ContextThread;
import com.roundabout.core.model.ResourceUsage;

import java.util.Map;

/**
 * Request for permission to perform a resource-consuming operation.
 *
 * @param operation          operation being requested
 * @param requestingAgentId  agent asking
 * @param estimatedCost      expected consumption of the operation
 * @param contextThread      thread the operation runs in; for clones this is the child's new thread
 * @param parameters         operation-specific parameters (e.g. {@code maxTokens} for model calls)
 */
public record ApprovalRequest(
    OperationType operation,
    String requestingAgentId,
    ResourceUsage estimatedCost,
    ContextThread contextThread,
    Map<String, Object> parameters
) {

    public static final String PARAM_MAX_TOKENS = "maxTokens";

    public ApprovalRequest {
        estimatedCost = estimatedCost == null ? ResourceUsage.ZERO : estimatedCost;
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public ApprovalRequest(OperationType operation, String requestingAgentId,
                           ResourceUsage estimatedCost, ContextThread contextThread) {
        this(operation, requestingAgentId, estimatedCost, contextThread, Map.of());
    }

    public ApprovalRequest withEstimatedCost(ResourceUsage cost) {
        return new ApprovalRequest(operation, requestingAgentId, cost, contextThread, parameters);
    }
}
