package com.roundabout.core.governor;

/**
 * Resource-consuming operations that must pass the governor.
 */
public enum OperationType {
    CLONE_AGENT("clone_agent"),
    LLM_CALL("llm_call"),
    MEMORY_ACCESS("memory_access"),
    EXTERNAL_API("external_api"),
    AUTONOMOUS_MODE("autonomous_mode");

    private final String wireName;

    OperationType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
