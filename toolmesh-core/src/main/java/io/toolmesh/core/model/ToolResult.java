package io.toolmesh.core.model;

import java.util.List;

public record ToolResult(List<ContentBlock> content, ToolError error) {

    public ToolResult {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static ToolResult ok(List<ContentBlock> content) {
        return new ToolResult(content, null);
    }

    public static ToolResult text(String text) {
        return ok(List.of(new TextContent(text)));
    }

    public static ToolResult error(ToolErrorKind kind, String message) {
        return new ToolResult(List.of(), new ToolError(kind, message));
    }

    public static ToolResult toolError(ToolErrorKind kind, String message) {
        return new ToolResult(List.of(), new ToolError(kind, message, true));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }
}
