package io.toolmesh.core.mcp;

import io.toolmesh.core.model.ToolErrorKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ServerBootstrapper implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ServerBootstrapper.class);

    private final ServerRegistry registry;
    private final ToolCallPipeline pipeline;
    private final RetryPolicy reconnectPolicy;
    private final Map<String, PendingServer> pending = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ServerBootstrapper(ServerRegistry registry, ToolCallPipeline pipeline, RetryPolicy reconnectPolicy) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.reconnectPolicy = reconnectPolicy == null ? RetryPolicy.none() : reconnectPolicy;
    }

    public CompletableFuture<StartupReport> connectAll(List<ServerEndpoint> endpoints) {
        List<ServerEndpoint> targets = endpoints == null ? List.of() : endpoints;
        if (targets.isEmpty()) {
            LOG.info("No MCP servers configured");
            return CompletableFuture.completedFuture(new StartupReport(List.of(), List.of()));
        }

        LOG.info("Connecting to {} configured MCP server(s)", targets.size());
        List<CompletableFuture<Boolean>> attempts = new ArrayList<>();
        for (ServerEndpoint endpoint : targets) {
            attempts.add(registry.addServer(endpoint.id(), endpoint.url(), endpoint.description())
                .handle((tools, error) -> {
                    if (error == null) {
                        LOG.info("Connected to MCP server '{}' ({} tools)", endpoint.id(), tools.size());
                        return true;
                    }
                    ToolServerException failure = ErrorClassifier.classify(
                        error, ErrorClassifier.Phase.INITIALIZE, endpoint.id(), null);
                    LOG.warn("Failed to connect to MCP server '{}': {}", endpoint.id(), failure.getMessage());
                    if (failure.kind() != ToolErrorKind.DUPLICATE_SERVER && failure.kind() != ToolErrorKind.INVALID_ARGS) {
                        schedule(endpoint, 1, failure.getMessage());
                    }
                    return false;
                }));
        }

        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).thenApply(ignored -> {
            List<String> succeeded = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            for (int i = 0; i < targets.size(); i++) {
                (attempts.get(i).join() ? succeeded : failed).add(targets.get(i).id());
            }
            LOG.info("MCP server connection results: {} successful, {} failed", succeeded.size(), failed.size());
            return new StartupReport(succeeded, failed);
        });
    }

    public List<PendingServer> pending() {
        return List.copyOf(pending.values());
    }

    @Override
    public void close() {
        closed = true;
        pending.clear();
    }

    private void schedule(ServerEndpoint endpoint, int attempt, String lastError) {
        // attempt counts reconnects; the startup attempt is not one of them
        if (closed || attempt >= reconnectPolicy.maxAttempts()) {
            pending.remove(endpoint.id());
            if (!closed) {
                LOG.error("Giving up on MCP server '{}' after {} reconnect attempt(s): {}", endpoint.id(), attempt - 1, lastError);
            }
            return;
        }
        pending.put(endpoint.id(), new PendingServer(endpoint, attempt, lastError));
        pipeline.delay(reconnectPolicy.delayBeforeAttempt(attempt + 1)).whenComplete((ignored, delayError) -> {
            if (delayError != null || closed) {
                pending.remove(endpoint.id());
                return;
            }
            registry.addServer(endpoint.id(), endpoint.url(), endpoint.description()).whenComplete((tools, error) -> {
                if (error == null) {
                    pending.remove(endpoint.id());
                    LOG.info("Reconnected to MCP server '{}' ({} tools)", endpoint.id(), tools.size());
                    return;
                }
                ToolServerException failure = ErrorClassifier.classify(
                    error, ErrorClassifier.Phase.INITIALIZE, endpoint.id(), null);
                if (failure.kind() == ToolErrorKind.DUPLICATE_SERVER) {
                    pending.remove(endpoint.id());
                    return;
                }
                LOG.debug("Reconnect attempt {} for MCP server '{}' failed: {}", attempt, endpoint.id(), failure.getMessage());
                schedule(endpoint, attempt + 1, failure.getMessage());
            });
        });
    }

    public record StartupReport(List<String> succeeded, List<String> failed) {

        public StartupReport {
            succeeded = List.copyOf(succeeded);
            failed = List.copyOf(failed);
        }
    }

    public record PendingServer(ServerEndpoint endpoint, int attempt, String lastError) {

        public ConnectionState state() {
            return ConnectionState.FAILED;
        }
    }
}
