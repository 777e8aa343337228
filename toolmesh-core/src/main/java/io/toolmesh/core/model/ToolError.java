package io.toolmesh.core.model;

import java.util.Objects;

public record ToolError(ToolErrorKind kind, String message, boolean reportedByTool) {

    public ToolError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null || message.isBlank() ? kind.name().toLowerCase() : message;
    }

    public ToolError(ToolErrorKind kind, String message) {
        this(kind, message, false);
    }

    // The tool ran and answered with isError; running it again could repeat its side effects.
    public boolean retryable() {
        return !reportedByTool && kind.retryable();
    }
}
