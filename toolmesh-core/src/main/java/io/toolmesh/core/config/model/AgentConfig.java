package io.toolmesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    String provider,
    String model,
    @JsonAlias({"system_prompt"}) String systemPrompt,
    @JsonAlias({"max_tool_rounds"}) int maxToolRounds,
    double temperature,
    @JsonAlias({"sessions_dir"}) String sessionsDir
) {

    public static AgentConfig defaults() {
        return new AgentConfig(
            "openrouter",
            "openai/gpt-4o-mini",
            "You are a helpful assistant with access to tools from connected MCP servers. "
                + "Use them when they help answer the user, and say so when a tool fails.",
            5,
            0.7,
            "~/.toolmesh/sessions"
        );
    }
}
