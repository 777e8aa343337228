package io.toolmesh.cli;

import io.toolmesh.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write config.json with current defaults and list the configured MCP servers")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace the existing config with defaults, dropping configured servers")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            String action = result.createdConfig() ? "Created" : result.overwrittenConfig() ? "Reset" : "Updated";
            System.out.println(action + " toolmesh config at " + result.configPath());
            System.out.println("Chat sessions are stored in " + result.sessionsPath());

            if (result.serverNames().isEmpty()) {
                System.out.println("No MCP servers configured. Add {\"name\", \"url\"} entries to mcp.servers, or use /add in chat.");
            } else {
                System.out.println("MCP servers: " + String.join(", ", result.serverNames()));
            }
            if (!result.defaultServerConfigured()) {
                System.err.println("Default server '" + result.defaultServer() + "' is not among the configured MCP servers");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
