package io.toolmesh.cli;

import io.toolmesh.core.admin.ToolAdminService;
import io.toolmesh.core.chat.ChatOrchestrator;
import io.toolmesh.core.config.ConfigService;
import io.toolmesh.core.mcp.ServerBootstrapper.StartupReport;
import io.toolmesh.core.model.QualifiedToolName;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public record CliContext(
    ChatOrchestrator orchestrator,
    ToolAdminService admin,
    ConfigService configService,
    Path configPath,
    ServerStartup serverStartup
) {
    public CliContext(ChatOrchestrator orchestrator, ToolAdminService admin, ConfigService configService, Path configPath) {
        this(orchestrator, admin, configService, configPath, () -> new StartupReport(List.of(), List.of()));
    }

    String qualifyToolName(String name) throws IOException {
        return QualifiedToolName.qualify(name, configService.load(configPath).mcp().settings().defaultServer());
    }
}
