package com.roundabout.core.agent;

import com.roundabout.core.model.AgentRole;
import com.roundabout.core.model.RelationalDelta;
import com.roundabout.core.model.UserInput;

/**
 * Role- and strategy-specific response text.
 */
final class ResponseComposer {

    private ResponseComposer() {}

    static String compose(AgentRole role, UserInput input, RelationalDelta delta) {
        return switch (role) {
            case COORDINATOR -> "Coordinator agent processing: " + input.text();
            case CORE -> "Core agent executing task: " + input.text();
            case CONSCIOUS -> conscious(input, delta);
        };
    }

    private static String conscious(UserInput input, RelationalDelta delta) {
        if (delta == null) {
            return "I'm processing your input: " + input.text();
        }
        return switch (delta.strategy()) {
            case MIRROR -> "I understand you're feeling " + interpretEmotion(input.text())
                    + ". Let me reflect that back to you.";
            case LISTEN -> "I'm here to listen. Please tell me more about what you're experiencing.";
            case HARMONIZE -> "I hear you, and I'd like to help guide us toward a solution together.";
        };
    }

    static String interpretEmotion(String text) {
        String lower = text.toLowerCase();
        if (lower.contains("angry") || text.contains("!")) {
            return "frustrated";
        }
        if (lower.contains("sad") || lower.contains("worried")) {
            return "concerned";
        }
        return "engaged";
    }
}
