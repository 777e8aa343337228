package io.toolmesh.core.mcp;

import io.toolmesh.core.model.ToolErrorKind;
import java.util.Objects;

public class ToolServerException extends RuntimeException {
    private final ToolErrorKind kind;
    private final String serverId;
    private final String toolName;

    public ToolServerException(ToolErrorKind kind, String message, String serverId, String toolName) {
        this(kind, message, serverId, toolName, null);
    }

    public ToolServerException(ToolErrorKind kind, String message, String serverId, String toolName, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.serverId = serverId == null ? "unknown" : serverId;
        this.toolName = toolName;
    }

    public ToolErrorKind kind() {
        return kind;
    }

    public String serverId() {
        return serverId;
    }

    public String toolName() {
        return toolName;
    }
}
