package io.toolmesh.cli;

import io.toolmesh.core.admin.AdminResponse;
import io.toolmesh.core.admin.ServerView;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "servers", description = "Connect the configured MCP servers and list them")
public final class ServersCommand implements Callable<Integer> {
    private final CliContext context;

    public ServersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CliPrinter.printStartup(context.serverStartup().connect(), System.err);
            AdminResponse<List<ServerView>> response = context.admin().listServers();
            CliPrinter.printServers(response.data(), System.out);
            return 0;
        } catch (Exception e) {
            System.err.println("Servers command failed: " + e.getMessage());
            return 1;
        }
    }
}
