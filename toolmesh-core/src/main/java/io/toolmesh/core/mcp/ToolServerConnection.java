package io.toolmesh.core.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.model.ContentBlock;
import io.toolmesh.core.model.EmbeddedResourceContent;
import io.toolmesh.core.model.ImageContent;
import io.toolmesh.core.model.QualifiedToolName;
import io.toolmesh.core.model.TextContent;
import io.toolmesh.core.model.ToolDescriptor;
import io.toolmesh.core.model.ToolErrorKind;
import io.toolmesh.core.model.ToolResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of one remote tool server: connect and fetch the catalog, invoke tools, close.
 *
 * <p>{@link #call} never completes exceptionally. Every failure, including a tool missing from the catalog or a
 * connection that is not ready, is returned as an error {@link ToolResult}.
 */
public final class ToolServerConnection implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ToolServerConnection.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String serverId;
    private final String endpoint;
    private final String description;
    private final McpTransport transport;
    private final ToolCallPipeline pipeline;
    private final ConnectionSettings settings;
    private final ObjectMapper mapper;
    private final Object lock = new Object();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Map<String, ToolDescriptor> tools = Map.of();
    private CompletableFuture<List<ToolDescriptor>> initializing;

    public ToolServerConnection(
        String serverId,
        String endpoint,
        String description,
        McpTransport transport,
        ToolCallPipeline pipeline,
        ConnectionSettings settings
    ) {
        this.serverId = Objects.requireNonNull(serverId, "serverId must not be null");
        this.endpoint = endpoint == null ? "" : endpoint;
        this.description = description == null ? "" : description;
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.settings = settings == null ? ConnectionSettings.defaults() : settings;
        this.mapper = new ObjectMapper();
    }

    public String serverId() {
        return serverId;
    }

    public String endpoint() {
        return endpoint;
    }

    public String description() {
        return description;
    }

    public ConnectionState state() {
        return state;
    }

    /**
     * Connects and fetches the tool catalog under the connection timeout. Calling it again on a ready connection
     * returns the cached catalog; concurrent callers share the in-flight attempt.
     */
    public CompletableFuture<List<ToolDescriptor>> initialize() {
        CompletableFuture<List<ToolDescriptor>> result;
        synchronized (lock) {
            if (state == ConnectionState.READY) {
                return CompletableFuture.completedFuture(listTools());
            }
            if (state == ConnectionState.CONNECTING && initializing != null) {
                return initializing;
            }
            state = ConnectionState.CONNECTING;
            result = new CompletableFuture<>();
            initializing = result;
        }

        LOG.debug("Connecting to MCP server '{}' at {}", serverId, endpoint);
        pipeline.withTimeout(
            () -> transport.connect().thenCompose(serverInfo -> fetchTools(null, new ArrayList<>())),
            settings.connectionTimeoutMs(),
            "MCP server '" + serverId + "' connection",
            serverId
        ).whenComplete((fetched, error) -> {
            if (error == null && markReady(result, fetched)) {
                result.complete(listTools());
                return;
            }
            ToolServerException failure = error == null
                ? new ToolServerException(ToolErrorKind.CONNECTION, "Connection to MCP server '" + serverId + "' was closed", serverId, null)
                : ErrorClassifier.classify(error, ErrorClassifier.Phase.INITIALIZE, serverId, null);
            rollback(result);
            LOG.error("Error initializing MCP client for '{}': {} ({})", serverId, failure.getMessage(), failure.kind());
            result.completeExceptionally(failure);
            // Also covers a close() that raced the handshake before the session id arrived.
            closeTransportQuietly();
        });
        return result;
    }

    public List<ToolDescriptor> listTools() {
        return List.copyOf(tools.values());
    }

    public CompletableFuture<ToolResult> call(String toolName, Map<String, Object> arguments) {
        try {
            if (state != ConnectionState.READY) {
                return CompletableFuture.completedFuture(ToolResult.error(
                    ToolErrorKind.CONNECTION,
                    "MCP server '" + serverId + "' is not connected (state " + state + ")"
                ));
            }
            if (toolName == null || !tools.containsKey(toolName)) {
                return CompletableFuture.completedFuture(ToolResult.error(
                    ToolErrorKind.TOOL_NOT_FOUND,
                    "Tool not found: " + toolName + " on MCP server '" + serverId + "'"
                ));
            }

            Map<String, Object> params = new LinkedHashMap<>();
            params.put("name", toolName);
            params.put("arguments", arguments == null ? Map.of() : arguments);
            return pipeline.withTimeout(
                    () -> transport.request("tools/call", params),
                    settings.callTimeoutMs(),
                    "Tool call '" + toolName + "'",
                    serverId
                )
                .thenApply(this::toToolResult)
                .exceptionally(error -> failedCall(toolName, error));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(failedCall(toolName, e));
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (state == ConnectionState.DISCONNECTED) {
                return;
            }
            state = ConnectionState.DISCONNECTED;
            tools = Map.of();
            initializing = null;
        }
        closeTransportQuietly();
        LOG.info("Closed connection to MCP server '{}'", serverId);
    }

    private boolean markReady(CompletableFuture<List<ToolDescriptor>> attempt, List<ToolDescriptor> fetched) {
        synchronized (lock) {
            if (initializing != attempt || state != ConnectionState.CONNECTING) {
                return false;
            }
            Map<String, ToolDescriptor> byName = new LinkedHashMap<>();
            for (ToolDescriptor descriptor : fetched) {
                byName.putIfAbsent(descriptor.name(), descriptor);
            }
            tools = byName;
            state = ConnectionState.READY;
            initializing = null;
            return true;
        }
    }

    private void rollback(CompletableFuture<List<ToolDescriptor>> attempt) {
        synchronized (lock) {
            if (initializing == attempt) {
                initializing = null;
                state = ConnectionState.DISCONNECTED;
                tools = Map.of();
            }
        }
    }

    private CompletableFuture<List<ToolDescriptor>> fetchTools(String cursor, List<ToolDescriptor> collected) {
        Map<String, Object> params = cursor == null ? Map.of() : Map.of("cursor", cursor);
        return transport.request("tools/list", params).thenCompose(result -> {
            collectTools(result.path("tools"), collected);
            String next = result.path("nextCursor").asText("");
            if (!next.isBlank() && !next.equals(cursor)) {
                return fetchTools(next, collected);
            }
            return CompletableFuture.completedFuture(collected);
        });
    }

    private void collectTools(JsonNode toolsNode, List<ToolDescriptor> collected) {
        if (toolsNode == null || !toolsNode.isArray()) {
            return;
        }
        for (JsonNode node : toolsNode) {
            String name = node.path("name").asText("");
            if (!QualifiedToolName.isValidSegment(name)) {
                LOG.warn("Skipping tool '{}' from MCP server '{}': name is empty or contains '{}'", name, serverId, QualifiedToolName.SEPARATOR);
                continue;
            }
            if (collected.stream().anyMatch(existing -> existing.name().equals(name))) {
                LOG.warn("Skipping duplicate tool '{}' from MCP server '{}'", name, serverId);
                continue;
            }
            JsonNode schema = node.path("inputSchema");
            Map<String, Object> inputSchema = schema.isObject() ? mapper.convertValue(schema, MAP_TYPE) : Map.of();
            collected.add(new ToolDescriptor(serverId, name, node.path("description").asText(""), inputSchema));
        }
    }

    private ToolResult toToolResult(JsonNode result) {
        List<ContentBlock> blocks = new ArrayList<>();
        JsonNode content = result.path("content");
        if (content.isArray()) {
            for (JsonNode item : content) {
                blocks.add(toContentBlock(item));
            }
        } else if (!result.isMissingNode() && !result.isNull() && !result.isEmpty()) {
            blocks.add(new TextContent(result.isTextual() ? result.asText() : result.toString()));
        }

        if (result.path("isError").asBoolean(false)) {
            String message = blocks.stream()
                .filter(TextContent.class::isInstance)
                .map(block -> ((TextContent) block).text())
                .collect(Collectors.joining("\n"));
            ToolErrorKind kind = ErrorClassifier.fromMessage(message, ErrorClassifier.Phase.CALL);
            return ToolResult.toolError(kind == ToolErrorKind.UNKNOWN ? ToolErrorKind.SERVER_ERROR : kind, message);
        }
        return ToolResult.ok(blocks);
    }

    private ContentBlock toContentBlock(JsonNode item) {
        String type = item.path("type").asText("");
        return switch (type) {
            case "text" -> new TextContent(item.path("text").asText(""));
            case "image" -> new ImageContent(item.path("data").asText(""), item.path("mimeType").asText(null));
            case "resource", "embedded_resource" -> new EmbeddedResourceContent(
                item.path("resource").isObject() ? mapper.convertValue(item.path("resource"), MAP_TYPE) : Map.of()
            );
            default -> new TextContent(item.toString());
        };
    }

    private ToolResult failedCall(String toolName, Throwable error) {
        ToolServerException failure = ErrorClassifier.classify(error, ErrorClassifier.Phase.CALL, serverId, toolName);
        LOG.warn("Error calling tool {} on '{}': {} ({})", toolName, serverId, failure.getMessage(), failure.kind());
        return ToolResult.error(failure.kind(), failure.getMessage());
    }

    private void closeTransportQuietly() {
        try {
            transport.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to close transport for MCP server '{}': {}", serverId, e.getMessage());
        }
    }
}
