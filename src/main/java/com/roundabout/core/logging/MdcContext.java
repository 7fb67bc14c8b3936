package com.roundabout.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Roundabout-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String AGENT_ID = "agentId";
    public static final String ROOT_AGENT_ID = "rootAgentId";
    public static final String PHASE = "phase";

    private MdcContext() {}

    public static void setAgent(String agentId, String rootAgentId) {
        MDC.put(AGENT_ID, agentId);
        MDC.put(ROOT_AGENT_ID, rootAgentId);
    }

    public static void setPhase(String agentId, String rootAgentId, String phase) {
        setAgent(agentId, rootAgentId);
        MDC.put(PHASE, phase);
    }

    public static void clear() {
        MDC.remove(AGENT_ID);
        MDC.remove(ROOT_AGENT_ID);
        MDC.remove(PHASE);
    }
}
