package io.toolmesh.cli;

import io.toolmesh.core.config.ConfigPaths;
import io.toolmesh.core.config.model.McpServerConfig;
import io.toolmesh.core.config.model.McpSettings;
import io.toolmesh.core.config.model.ToolmeshConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ToolmeshConfig config = context.configService().load(context.configPath());
            McpSettings settings = config.mcp().settings();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Sessions: " + ConfigPaths.resolveSessionsDir(config.agent().sessionsDir()));
            System.out.println("Default provider: " + config.agent().provider());
            System.out.println("Default model: " + config.agent().model());
            System.out.println("Max tool rounds: " + config.agent().maxToolRounds());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("MCP servers configured: " + config.mcp().servers().size());
            for (McpServerConfig server : config.mcp().servers()) {
                System.out.println("  " + server.name() + " -> " + server.url());
            }
            System.out.println("MCP timeouts: connection " + settings.connectionTimeout() + "ms, call " + settings.callTimeout() + "ms");
            System.out.println("MCP retries: " + settings.maxRetries() + " every " + settings.retryInterval() + "ms");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
