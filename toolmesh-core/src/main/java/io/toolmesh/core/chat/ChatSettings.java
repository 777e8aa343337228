package io.toolmesh.core.chat;

import java.util.Objects;

public record ChatSettings(String model, String systemPrompt, int maxToolRounds, Double temperature) {
    public static final int DEFAULT_MAX_TOOL_ROUNDS = 5;

    public ChatSettings {
        Objects.requireNonNull(model, "model must not be null");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        maxToolRounds = maxToolRounds <= 0 ? DEFAULT_MAX_TOOL_ROUNDS : maxToolRounds;
    }

    public static ChatSettings of(String model) {
        return new ChatSettings(model, "", DEFAULT_MAX_TOOL_ROUNDS, null);
    }
}
