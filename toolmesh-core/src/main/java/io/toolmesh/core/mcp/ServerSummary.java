package io.toolmesh.core.mcp;

public record ServerSummary(String id, String endpoint, String description, ConnectionState state, int toolCount) {
}
