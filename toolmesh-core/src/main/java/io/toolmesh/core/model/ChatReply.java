package io.toolmesh.core.model;

import java.util.List;

public record ChatReply(
    String sessionId,
    ChatMessage message,
    List<ToolInvocation> invocations,
    int rounds,
    boolean roundLimitReached,
    List<ChatMessage> history
) {

    public ChatReply {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        history = history == null ? List.of() : List.copyOf(history);
    }

    public String content() {
        return message.content();
    }
}
