package io.toolmesh.core.model;

import io.toolmesh.core.mcp.ToolServerException;

public record QualifiedToolName(String serverId, String toolName) {
    public static final String SEPARATOR = "__";

    public QualifiedToolName {
        if (!isValidSegment(serverId) || !isValidSegment(toolName)) {
            throw new ToolServerException(
                ToolErrorKind.MALFORMED_TOOL_NAME,
                "Invalid tool name segments: '" + serverId + "', '" + toolName + "'",
                serverId,
                toolName
            );
        }
    }

    public static QualifiedToolName of(String serverId, String toolName) {
        return new QualifiedToolName(serverId, toolName);
    }

    public static QualifiedToolName parse(String qualifiedName) {
        String raw = qualifiedName == null ? "" : qualifiedName;
        String[] parts = raw.split(SEPARATOR, -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new ToolServerException(
                ToolErrorKind.MALFORMED_TOOL_NAME,
                "Invalid tool name format: " + raw + ". Expected format: serverId" + SEPARATOR + "toolName",
                null,
                raw
            );
        }
        return new QualifiedToolName(parts[0], parts[1]);
    }

    // Bare tool names are routed to the default server; anything already qualified passes through.
    public static String qualify(String name, String defaultServer) {
        if (name == null || name.contains(SEPARATOR) || !isValidSegment(defaultServer)) {
            return name;
        }
        return defaultServer + SEPARATOR + name;
    }

    public static boolean isValidSegment(String segment) {
        return segment != null && !segment.isBlank() && !segment.contains(SEPARATOR);
    }

    public String value() {
        return serverId + SEPARATOR + toolName;
    }

    @Override
    public String toString() {
        return value();
    }
}
