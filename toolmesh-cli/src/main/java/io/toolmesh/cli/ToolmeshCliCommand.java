package io.toolmesh.cli;

import picocli.CommandLine.Command;

@Command(name = "toolmesh", mixinStandardHelpOptions = true, description = "Chat with an LLM over tools from many MCP servers")
public final class ToolmeshCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
