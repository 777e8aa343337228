package io.toolmesh.core.model;

import java.util.Objects;

// arguments is the raw JSON string from the model, parsed only when the call runs.
public record ToolCall(String id, String name, String arguments) {

    public ToolCall {
        Objects.requireNonNull(name, "name must not be null");
        id = id == null ? "" : id;
        arguments = arguments == null ? "" : arguments;
    }
}
