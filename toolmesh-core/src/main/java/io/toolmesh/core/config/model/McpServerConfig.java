package io.toolmesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.toolmesh.core.mcp.ServerEndpoint;

@JsonIgnoreProperties(ignoreUnknown = true)
public record McpServerConfig(String name, String url, String description) {

    public ServerEndpoint toEndpoint() {
        return new ServerEndpoint(name, url, description);
    }
}
