package io.toolmesh.core.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.model.ContentBlock;
import io.toolmesh.core.model.EmbeddedResourceContent;
import io.toolmesh.core.model.ImageContent;
import io.toolmesh.core.model.TextContent;
import io.toolmesh.core.model.ToolError;
import io.toolmesh.core.model.ToolResult;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ToolResultRenderer {
    private final ObjectMapper mapper;

    public ToolResultRenderer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String render(ToolResult result) {
        if (result.isError()) {
            return renderError(result.error(), Map.of());
        }
        StringBuilder out = new StringBuilder();
        for (ContentBlock block : result.content()) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(renderBlock(block));
        }
        return out.toString();
    }

    public String renderError(ToolError error, Map<String, Object> extra) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", error.kind().name());
        body.put("message", error.message());
        body.putAll(extra);
        return toJson(Map.of("error", body));
    }

    private String renderBlock(ContentBlock block) {
        if (block instanceof TextContent text) {
            return text.text();
        }
        if (block instanceof ImageContent image) {
            return "[image: " + image.mimeType() + ", " + image.data().length() + " base64 chars]";
        }
        if (block instanceof EmbeddedResourceContent resource) {
            return "[embedded resource: " + toJson(resource.resource()) + "]";
        }
        return toJson(block);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
