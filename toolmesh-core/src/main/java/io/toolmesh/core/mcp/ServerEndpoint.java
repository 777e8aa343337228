package io.toolmesh.core.mcp;

public record ServerEndpoint(String id, String url, String description) {

    public ServerEndpoint {
        description = description == null ? "" : description;
    }
}
