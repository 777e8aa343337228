package io.toolmesh.core.admin;

import java.util.Map;

public record ToolView(String name, String description, String fullName, Map<String, Object> schema) {
}
