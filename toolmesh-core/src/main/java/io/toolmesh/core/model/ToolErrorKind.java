package io.toolmesh.core.model;

public enum ToolErrorKind {
    TIMEOUT,
    CONNECTION,
    SERVER_ERROR,
    TOOL_NOT_FOUND,
    INVALID_ARGS,
    DUPLICATE_SERVER,
    MALFORMED_TOOL_NAME,
    SERVER_NOT_FOUND,
    UNKNOWN;

    public boolean retryable() {
        return this == TIMEOUT || this == CONNECTION;
    }
}
