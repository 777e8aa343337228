package io.toolmesh.core.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpMcpTransport implements McpTransport {
    private static final Logger LOG = LoggerFactory.getLogger(HttpMcpTransport.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String PROTOCOL_VERSION = "2025-03-26";
    static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final String CLIENT_NAME = "toolmesh";
    private static final String CLIENT_VERSION = "0.1.0";
    private static final Duration SESSION_DELETE_TIMEOUT = Duration.ofSeconds(5);

    private final String serverId;
    private final HttpUrl endpoint;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final AtomicLong requestIds = new AtomicLong();
    private volatile String sessionId;

    public HttpMcpTransport(String serverId, String endpoint, OkHttpClient client, ObjectMapper mapper) {
        this.serverId = Objects.requireNonNull(serverId, "serverId must not be null");
        this.endpoint = HttpUrl.get(Objects.requireNonNull(endpoint, "endpoint must not be null"));
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public static McpTransportFactory factory(OkHttpClient client, ObjectMapper mapper) {
        return (serverId, endpoint) -> new HttpMcpTransport(serverId, endpoint, client, mapper);
    }

    @Override
    public CompletableFuture<JsonNode> connect() {
        sessionId = null;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolVersion", PROTOCOL_VERSION);
        params.put("capabilities", Map.of());
        params.put("clientInfo", Map.of("name", CLIENT_NAME, "version", CLIENT_VERSION));

        return request("initialize", params).thenCompose(serverInfo -> {
            LOG.debug(
                "MCP server '{}' initialized (protocol {}, session {})",
                serverId,
                serverInfo.path("protocolVersion").asText("?"),
                sessionId
            );
            return post(message(null, "notifications/initialized", null), null).thenApply(ignored -> serverInfo);
        });
    }

    @Override
    public CompletableFuture<JsonNode> request(String method, Map<String, Object> params) {
        long id = requestIds.incrementAndGet();
        return post(message(id, method, params), id);
    }

    @Override
    public void close() {
        String session = sessionId;
        sessionId = null;
        if (session == null) {
            return;
        }
        Request request = new Request.Builder()
            .url(endpoint)
            .delete()
            .header(SESSION_HEADER, session)
            .build();
        Call call = client.newCall(request);
        call.timeout().timeout(SESSION_DELETE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                LOG.debug("Session termination for MCP server '{}' failed: {}", serverId, e.getMessage());
            }

            @Override
            public void onResponse(Call completed, Response response) {
                try (response) {
                    // 405 means the server does not support explicit session termination.
                    if (!response.isSuccessful() && response.code() != 405) {
                        LOG.warn("Session termination for MCP server '{}' failed with HTTP {}", serverId, response.code());
                    }
                }
            }
        });
    }

    String sessionId() {
        return sessionId;
    }

    private Map<String, Object> message(Long id, String method, Map<String, Object> params) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("jsonrpc", "2.0");
        if (id != null) {
            message.put("id", id);
        }
        message.put("method", method);
        if (params != null) {
            message.put("params", params);
        }
        return message;
    }

    private CompletableFuture<JsonNode> post(Map<String, Object> message, Long id) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        Request request;
        try {
            Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(message), JSON))
                .header("Accept", "application/json, text/event-stream");
            String session = sessionId;
            if (session != null) {
                builder.header(SESSION_HEADER, session);
            }
            request = builder.build();
        } catch (IOException e) {
            future.completeExceptionally(e);
            return future;
        }

        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    future.complete(readResponse(response, id));
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    private JsonNode readResponse(Response response, Long id) throws IOException {
        String session = response.header(SESSION_HEADER);
        if (session != null && !session.isBlank()) {
            sessionId = session;
        }
        ResponseBody body = response.body();
        if (!response.isSuccessful()) {
            String errorBody = body == null ? "" : body.string();
            throw McpTransportException.http(
                response.code(),
                "MCP server '" + serverId + "' returned HTTP " + response.code() + (errorBody.isBlank() ? "" : ": " + errorBody)
            );
        }
        if (id == null) {
            return NullNode.getInstance();
        }
        if (body == null) {
            throw McpTransportException.protocol("Empty response from MCP server '" + serverId + "'");
        }

        String contentType = response.header("Content-Type", "");
        JsonNode message = contentType.contains("text/event-stream")
            ? readEventStream(body.source(), id)
            : mapper.readTree(body.string());
        return unwrap(message);
    }

    private JsonNode readEventStream(BufferedSource source, long id) throws IOException {
        StringBuilder data = new StringBuilder();
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null) {
                break;
            }
            if (line.isBlank()) {
                JsonNode message = dispatchEvent(data, id);
                if (message != null) {
                    return message;
                }
                continue;
            }
            if (line.startsWith("data:")) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(5).trim());
            }
        }
        JsonNode message = dispatchEvent(data, id);
        if (message != null) {
            return message;
        }
        throw McpTransportException.protocol("Event stream from MCP server '" + serverId + "' ended without a response to request " + id);
    }

    private JsonNode dispatchEvent(StringBuilder data, long id) throws IOException {
        if (data.length() == 0) {
            return null;
        }
        JsonNode event = mapper.readTree(data.toString());
        data.setLength(0);
        boolean isResponse = event.has("result") || event.has("error");
        if (isResponse && event.path("id").asLong(-1) == id) {
            return event;
        }
        LOG.debug("Ignoring event from MCP server '{}': {}", serverId, event.path("method").asText("response"));
        return null;
    }

    private JsonNode unwrap(JsonNode message) throws McpTransportException {
        JsonNode error = message.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw McpTransportException.rpc(
                error.path("code").asInt(McpTransportException.NO_RPC_CODE),
                error.path("message").asText("JSON-RPC error")
            );
        }
        JsonNode result = message.path("result");
        return result.isMissingNode() ? NullNode.getInstance() : result;
    }
}
