package com.roundabout.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Input handed to {@code CognitiveAgent.processInput}.
 *
 * @param text      raw input text
 * @param type      input classification
 * @param userState emotional state accompanying the input (nullable)
 * @param timestamp when the input was received
 */
public record UserInput(
    String text,
    InputType type,
    UserState userState,
    Instant timestamp
) {

    public UserInput {
        text = text == null ? "" : text;
        type = type == null ? InputType.CHAT : type;
    }

    public static UserInput chat(String text, Instant timestamp) {
        return new UserInput(text, InputType.CHAT, null, timestamp);
    }

    public UserInput withUserState(UserState state) {
        return new UserInput(text, type, state, timestamp);
    }

    public Optional<UserState> userStateOpt() {
        return Optional.ofNullable(userState);
    }
}
