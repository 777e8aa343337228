package io.toolmesh.core.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public record ToolInvocation(
    String qualifiedName,
    Map<String, Object> arguments,
    ToolResult result,
    Duration duration,
    int attempts
) {

    public ToolInvocation {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(result, "result must not be null");
        arguments = arguments == null ? Map.of() : arguments;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public ToolErrorKind errorKind() {
        return result.isError() ? result.error().kind() : null;
    }
}
