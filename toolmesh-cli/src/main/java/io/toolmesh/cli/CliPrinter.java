package io.toolmesh.cli;

import io.toolmesh.core.admin.AdminResponse;
import io.toolmesh.core.admin.ServerView;
import io.toolmesh.core.admin.ToolView;
import io.toolmesh.core.mcp.ServerBootstrapper.StartupReport;
import java.io.PrintStream;
import java.util.List;

final class CliPrinter {

    private CliPrinter() {
    }

    static void printServers(List<ServerView> servers, PrintStream out) {
        if (servers.isEmpty()) {
            out.println("No MCP servers connected.");
            return;
        }
        for (ServerView server : servers) {
            String line = server.id() + "  [" + server.state() + "]  " + server.toolCount() + " tools";
            if (server.description() != null && !server.description().isBlank()) {
                line += "  " + server.description();
            }
            out.println(line);
        }
    }

    static void printTools(List<ToolView> tools, PrintStream out) {
        if (tools.isEmpty()) {
            out.println("No tools available.");
            return;
        }
        for (ToolView tool : tools) {
            String line = tool.fullName();
            if (tool.description() != null && !tool.description().isBlank()) {
                line += "  " + tool.description();
            }
            out.println(line);
        }
    }

    static void printStartup(StartupReport report, PrintStream err) {
        if (!report.failed().isEmpty()) {
            err.println("Could not connect to MCP server(s): " + String.join(", ", report.failed()));
        }
    }

    static String errorText(AdminResponse<?> response) {
        if (response.error() == null) {
            return "unknown error";
        }
        return response.error().code() + ": " + response.error().message();
    }
}
