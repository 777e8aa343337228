package io.toolmesh.core.mcp;

import io.toolmesh.core.model.QualifiedToolName;
import io.toolmesh.core.model.ToolDescriptor;
import io.toolmesh.core.model.ToolErrorKind;
import io.toolmesh.core.model.ToolInvocation;
import io.toolmesh.core.model.ToolResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named collection of tool server connections and the aggregated, qualified tool catalog.
 *
 * <p>Readers see an immutable snapshot; writers swap the snapshot under a single lock. A server becomes visible
 * only after its catalog has been fetched, so a failed add leaves the registry exactly as it was.
 */
public final class ServerRegistry implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ServerRegistry.class);

    private final McpTransportFactory transportFactory;
    private final ToolCallPipeline pipeline;
    private final ConnectionSettings connectionSettings;
    private final RetryPolicy callRetryPolicy;
    private final Object lock = new Object();
    private final Set<String> pending = new HashSet<>();

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public ServerRegistry(
        McpTransportFactory transportFactory,
        ToolCallPipeline pipeline,
        ConnectionSettings connectionSettings,
        RetryPolicy callRetryPolicy
    ) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.connectionSettings = connectionSettings == null ? ConnectionSettings.defaults() : connectionSettings;
        this.callRetryPolicy = callRetryPolicy == null ? RetryPolicy.none() : callRetryPolicy;
    }

    public CompletableFuture<List<ToolDescriptor>> addServer(String id, String endpoint, String description) {
        if (!QualifiedToolName.isValidSegment(id)) {
            return CompletableFuture.failedFuture(new ToolServerException(
                ToolErrorKind.INVALID_ARGS,
                "Invalid MCP server name '" + id + "': must be non-empty and must not contain '" + QualifiedToolName.SEPARATOR + "'",
                id,
                null
            ));
        }
        if (endpoint == null || endpoint.isBlank()) {
            return CompletableFuture.failedFuture(new ToolServerException(
                ToolErrorKind.INVALID_ARGS, "MCP server '" + id + "' has no endpoint URL", id, null));
        }

        synchronized (lock) {
            if (snapshot.connections.containsKey(id) || pending.contains(id)) {
                return CompletableFuture.failedFuture(new ToolServerException(
                    ToolErrorKind.DUPLICATE_SERVER, "MCP server with name '" + id + "' already exists", id, null));
            }
            pending.add(id);
        }

        ToolServerConnection connection;
        try {
            connection = new ToolServerConnection(
                id, endpoint, description, transportFactory.create(id, endpoint), pipeline, connectionSettings);
        } catch (RuntimeException e) {
            synchronized (lock) {
                pending.remove(id);
            }
            return CompletableFuture.failedFuture(ErrorClassifier.classify(e, ErrorClassifier.Phase.INITIALIZE, id, null));
        }

        CompletableFuture<List<ToolDescriptor>> result = new CompletableFuture<>();
        connection.initialize().whenComplete((tools, error) -> {
            if (error != null) {
                synchronized (lock) {
                    pending.remove(id);
                }
                ToolServerException cause = ErrorClassifier.classify(error, ErrorClassifier.Phase.INITIALIZE, id, null);
                result.completeExceptionally(new ToolServerException(
                    cause.kind(), "Failed to add MCP server '" + id + "': " + cause.getMessage(), id, null, cause));
                return;
            }

            boolean published;
            synchronized (lock) {
                published = pending.remove(id);
                if (published) {
                    snapshot = snapshot.with(connection);
                }
            }
            if (!published) {
                connection.close();
                result.completeExceptionally(new ToolServerException(
                    ToolErrorKind.CONNECTION, "MCP server '" + id + "' was closed while connecting", id, null));
                return;
            }
            LOG.info("Added MCP server '{}' with {} tools", id, tools.size());
            result.complete(tools);
        });
        return result;
    }

    public boolean removeServer(String id) {
        ToolServerConnection connection;
        synchronized (lock) {
            connection = snapshot.connections.get(id);
            if (connection == null) {
                return false;
            }
            snapshot = snapshot.without(id);
        }
        connection.close();
        LOG.info("Removed MCP server '{}'", id);
        return true;
    }

    public boolean hasServer(String id) {
        return snapshot.connections.containsKey(id);
    }

    public List<ServerSummary> listServers() {
        List<ServerSummary> summaries = new ArrayList<>();
        for (ToolServerConnection connection : snapshot.connections.values()) {
            summaries.add(summarize(connection));
        }
        return summaries;
    }

    public Optional<ServerSummary> server(String id) {
        ToolServerConnection connection = snapshot.connections.get(id);
        return connection == null ? Optional.empty() : Optional.of(summarize(connection));
    }

    public Optional<List<ToolDescriptor>> listServerTools(String id) {
        ToolServerConnection connection = snapshot.connections.get(id);
        return connection == null ? Optional.empty() : Optional.of(connection.listTools());
    }

    public Map<String, ToolDescriptor> listAllTools() {
        return snapshot.catalog;
    }

    /**
     * Routes a call by its qualified name. A malformed name or an unknown server fails synchronously with a
     * {@link ToolServerException}; anything that happens on the server comes back inside the invocation's result.
     */
    public CompletableFuture<ToolInvocation> dispatch(String qualifiedName, Map<String, Object> arguments) {
        QualifiedToolName name = QualifiedToolName.parse(qualifiedName);
        ToolServerConnection connection = snapshot.connections.get(name.serverId());
        if (connection == null) {
            throw new ToolServerException(
                ToolErrorKind.SERVER_NOT_FOUND,
                "MCP server '" + name.serverId() + "' does not exist",
                name.serverId(),
                name.toolName()
            );
        }

        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        long started = System.nanoTime();
        return pipeline.<ToolResult>retrying(
                () -> connection.call(name.toolName(), args),
                callRetryPolicy,
                (result, error) -> error != null || (result.isError() && result.error().retryable())
            )
            .handle((attempted, error) -> {
                Duration took = Duration.ofNanos(System.nanoTime() - started);
                if (error != null) {
                    ToolServerException failure = ErrorClassifier.classify(
                        error, ErrorClassifier.Phase.CALL, name.serverId(), name.toolName());
                    return new ToolInvocation(
                        name.value(), args, ToolResult.error(failure.kind(), failure.getMessage()), took, callRetryPolicy.maxAttempts());
                }
                LOG.debug("Tool {} finished in {}ms after {} attempt(s)", name, took.toMillis(), attempted.attempts());
                return new ToolInvocation(name.value(), args, attempted.value(), took, attempted.attempts());
            });
    }

    public void closeAll() {
        List<ToolServerConnection> closing;
        synchronized (lock) {
            closing = new ArrayList<>(snapshot.connections.values());
            snapshot = Snapshot.EMPTY;
            pending.clear();
        }
        for (ToolServerConnection connection : closing) {
            connection.close();
        }
        if (!closing.isEmpty()) {
            LOG.info("Closed {} MCP server connection(s)", closing.size());
        }
    }

    @Override
    public void close() {
        closeAll();
    }

    private static ServerSummary summarize(ToolServerConnection connection) {
        return new ServerSummary(
            connection.serverId(),
            connection.endpoint(),
            connection.description(),
            connection.state(),
            connection.listTools().size()
        );
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        final Map<String, ToolServerConnection> connections;
        final Map<String, ToolDescriptor> catalog;

        private Snapshot(Map<String, ToolServerConnection> connections, Map<String, ToolDescriptor> catalog) {
            this.connections = connections;
            this.catalog = catalog;
        }

        Snapshot with(ToolServerConnection connection) {
            Map<String, ToolServerConnection> next = new LinkedHashMap<>(connections);
            next.put(connection.serverId(), connection);
            return of(next);
        }

        Snapshot without(String id) {
            Map<String, ToolServerConnection> next = new LinkedHashMap<>(connections);
            next.remove(id);
            return of(next);
        }

        private static Snapshot of(Map<String, ToolServerConnection> connections) {
            Map<String, ToolDescriptor> catalog = new LinkedHashMap<>();
            for (ToolServerConnection connection : connections.values()) {
                for (ToolDescriptor tool : connection.listTools()) {
                    catalog.put(tool.qualifiedName(), tool);
                }
            }
            return new Snapshot(
                Collections.unmodifiableMap(connections),
                Collections.unmodifiableMap(catalog)
            );
        }
    }
}
