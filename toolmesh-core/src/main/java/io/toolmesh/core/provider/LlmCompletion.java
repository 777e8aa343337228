package io.toolmesh.core.provider;

import io.toolmesh.core.model.ToolCall;
import java.util.List;
import java.util.Map;

public record LlmCompletion(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {

    public LlmCompletion {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Map.of() : usage;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
