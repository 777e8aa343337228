package io.toolmesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolmeshConfig(
    AgentConfig agent,
    ProvidersConfig providers,
    McpConfig mcp
) {

    public static ToolmeshConfig defaults() {
        return new ToolmeshConfig(
            AgentConfig.defaults(),
            ProvidersConfig.defaults(),
            McpConfig.defaults()
        );
    }
}
