package io.toolmesh.cli;

import io.toolmesh.core.mcp.ServerBootstrapper.StartupReport;

@FunctionalInterface
public interface ServerStartup {
    StartupReport connect() throws Exception;
}
