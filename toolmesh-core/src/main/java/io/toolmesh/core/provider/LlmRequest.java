package io.toolmesh.core.provider;

import io.toolmesh.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record LlmRequest(
    String model,
    List<ChatMessage> messages,
    List<Map<String, Object>> tools,
    String toolChoice,
    Double temperature
) {

    public LlmRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}
