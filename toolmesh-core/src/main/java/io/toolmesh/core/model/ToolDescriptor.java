package io.toolmesh.core.model;

import java.util.Map;
import java.util.Objects;

public record ToolDescriptor(
    String serverId,
    String name,
    String description,
    Map<String, Object> inputSchema
) {

    public ToolDescriptor {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? Map.of() : inputSchema;
    }

    public String qualifiedName() {
        return QualifiedToolName.of(serverId, name).value();
    }
}
