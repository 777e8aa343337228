package io.toolmesh.core.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.mcp.ToolServerException;
import io.toolmesh.core.model.ToolCall;
import io.toolmesh.core.model.ToolErrorKind;
import java.util.Locale;
import java.util.Map;

public final class ToolArgumentParser {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public ToolArgumentParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, Object> parse(ToolCall call) {
        String raw = call.arguments();
        if (raw.isBlank()) {
            return Map.of();
        }
        JsonNode node;
        try {
            node = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ToolServerException(
                ToolErrorKind.INVALID_ARGS,
                "Failed to parse tool arguments: " + e.getOriginalMessage(),
                null,
                call.name()
            );
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ToolServerException(
                ToolErrorKind.INVALID_ARGS,
                "Tool arguments must be a JSON object, got " + node.getNodeType().name().toLowerCase(Locale.ROOT),
                null,
                call.name()
            );
        }
        return mapper.convertValue(node, MAP_TYPE);
    }
}
