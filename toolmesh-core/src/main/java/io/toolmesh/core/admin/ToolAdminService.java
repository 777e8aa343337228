package io.toolmesh.core.admin;

import io.toolmesh.core.mcp.ErrorClassifier;
import io.toolmesh.core.mcp.ServerBootstrapper;
import io.toolmesh.core.mcp.ServerRegistry;
import io.toolmesh.core.mcp.ServerSummary;
import io.toolmesh.core.mcp.ToolServerException;
import io.toolmesh.core.model.ToolDescriptor;
import io.toolmesh.core.model.ToolErrorKind;
import io.toolmesh.core.model.ToolResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolAdminService {
    private static final Logger LOG = LoggerFactory.getLogger(ToolAdminService.class);
    static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private final ServerRegistry registry;
    private final ServerBootstrapper bootstrapper;

    public ToolAdminService(ServerRegistry registry) {
        this(registry, null);
    }

    public ToolAdminService(ServerRegistry registry, ServerBootstrapper bootstrapper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.bootstrapper = bootstrapper;
    }

    public CompletableFuture<AdminResponse<AddedServer>> addServer(String name, String url, String description) {
        if (name == null || name.isBlank() || url == null || url.isBlank()) {
            return CompletableFuture.completedFuture(
                AdminResponse.failure(VALIDATION_ERROR, "Server name and URL are required"));
        }
        String trimmedName = name.trim();
        String trimmedUrl = url.trim();
        String text = description == null ? "" : description.trim();
        try {
            return registry.addServer(trimmedName, trimmedUrl, text).<AdminResponse<AddedServer>>handle((tools, error) -> {
                if (error != null) {
                    ToolServerException failure = ErrorClassifier.classify(
                        error, ErrorClassifier.Phase.INITIALIZE, trimmedName, null);
                    LOG.warn("Admin add of MCP server '{}' failed: {}", trimmedName, failure.getMessage());
                    return AdminResponse.failure(failure.kind().name(), failure.getMessage());
                }
                return AdminResponse.ok(
                    new AddedServer(trimmedName, trimmedUrl, text, views(tools)),
                    "MCP server '" + trimmedName + "' added with " + tools.size() + " tools"
                );
            });
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(AdminResponse.failure(
                ErrorClassifier.kindOf(e, ErrorClassifier.Phase.INITIALIZE).name(), ErrorClassifier.messageOf(e)));
        }
    }

    public AdminResponse<Boolean> removeServer(String id) {
        if (id == null || id.isBlank()) {
            return AdminResponse.failure(VALIDATION_ERROR, "Server id is required");
        }
        if (!registry.removeServer(id)) {
            return AdminResponse.failure(ToolErrorKind.SERVER_NOT_FOUND.name(), "MCP server '" + id + "' does not exist");
        }
        return AdminResponse.ok(true, "MCP server '" + id + "' removed");
    }

    // Registered servers first, then configured ones still waiting for a background reconnect.
    public AdminResponse<List<ServerView>> listServers() {
        List<ServerView> views = new ArrayList<>();
        for (ServerSummary summary : registry.listServers()) {
            views.add(new ServerView(summary.id(), summary.toolCount(), summary.description(), summary.state().name()));
        }
        if (bootstrapper != null) {
            for (ServerBootstrapper.PendingServer pending : bootstrapper.pending()) {
                views.add(new ServerView(
                    pending.endpoint().id(), 0, pending.endpoint().description(), pending.state().name()));
            }
        }
        return AdminResponse.ok(views);
    }

    public AdminResponse<List<ToolView>> listTools(String serverId) {
        if (serverId == null || serverId.isBlank()) {
            return AdminResponse.ok(views(registry.listAllTools().values()));
        }
        Optional<List<ToolDescriptor>> tools = registry.listServerTools(serverId);
        if (tools.isEmpty()) {
            return AdminResponse.failure(ToolErrorKind.SERVER_NOT_FOUND.name(), "MCP server '" + serverId + "' does not exist");
        }
        return AdminResponse.ok(views(tools.get()));
    }

    public CompletableFuture<AdminResponse<ToolResult>> callTool(String qualifiedName, Map<String, Object> arguments) {
        if (qualifiedName == null || qualifiedName.isBlank()) {
            return CompletableFuture.completedFuture(AdminResponse.failure(VALIDATION_ERROR, "Tool name is required"));
        }
        try {
            return registry.dispatch(qualifiedName, arguments).<AdminResponse<ToolResult>>thenApply(invocation -> {
                ToolResult result = invocation.result();
                if (result.isError()) {
                    return new AdminResponse<>(
                        false, result, null, new AdminResponse.AdminError(result.error().kind().name(), result.error().message()));
                }
                return AdminResponse.ok(result);
            });
        } catch (ToolServerException e) {
            return CompletableFuture.completedFuture(AdminResponse.failure(e.kind().name(), e.getMessage()));
        }
    }

    private static List<ToolView> views(Collection<ToolDescriptor> tools) {
        List<ToolView> views = new ArrayList<>();
        for (ToolDescriptor tool : tools) {
            views.add(new ToolView(tool.name(), tool.description(), tool.qualifiedName(), tool.inputSchema()));
        }
        return views;
    }
}
