package io.toolmesh.core.mcp;

@FunctionalInterface
public interface McpTransportFactory {
    McpTransport create(String serverId, String endpoint);
}
