package io.toolmesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record McpConfig(List<McpServerConfig> servers, McpSettings settings) {

    public McpConfig {
        servers = servers == null ? List.of() : List.copyOf(servers);
        settings = settings == null ? McpSettings.defaults() : settings;
    }

    public static McpConfig defaults() {
        return new McpConfig(List.of(), McpSettings.defaults());
    }
}
