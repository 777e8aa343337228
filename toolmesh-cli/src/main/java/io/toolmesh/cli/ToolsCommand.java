package io.toolmesh.cli;

import io.toolmesh.core.admin.AdminResponse;
import io.toolmesh.core.admin.ToolView;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "tools", description = "List the tools of all connected MCP servers")
public final class ToolsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-s", "--server"}, description = "Only list tools of this server")
    String server;

    public ToolsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CliPrinter.printStartup(context.serverStartup().connect(), System.err);
            AdminResponse<List<ToolView>> response = context.admin().listTools(server);
            if (!response.success()) {
                System.err.println("Tools command failed: " + CliPrinter.errorText(response));
                return 1;
            }
            CliPrinter.printTools(response.data(), System.out);
            return 0;
        } catch (Exception e) {
            System.err.println("Tools command failed: " + e.getMessage());
            return 1;
        }
    }
}
