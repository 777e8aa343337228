package io.toolmesh.core.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.model.ToolErrorKind;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpMcpTransportTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private HttpMcpTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        transport = new HttpMcpTransport("chain", server.url("/mcp").toString(), new OkHttpClient(), mapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPerformHandshakeAndEchoSessionHeader() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setHeader("Mcp-Session-Id", "session-7")
            .setBody("""
                {"jsonrpc":"2.0","id":1,"result":{"protocolVersion":"2025-03-26","serverInfo":{"name":"chain"}}}
                """));
        server.enqueue(new MockResponse().setResponseCode(202));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"jsonrpc":"2.0","id":2,"result":{"tools":[{"name":"gasPrice"}]}}
                """));

        JsonNode info = transport.connect().join();
        JsonNode tools = transport.request("tools/list", Map.of()).join();

        assertThat(info.path("serverInfo").path("name").asText()).isEqualTo("chain");
        assertThat(tools.path("tools").get(0).path("name").asText()).isEqualTo("gasPrice");
        assertThat(transport.sessionId()).isEqualTo("session-7");

        RecordedRequest initialize = server.takeRequest();
        assertThat(initialize.getMethod()).isEqualTo("POST");
        assertThat(initialize.getPath()).isEqualTo("/mcp");
        assertThat(initialize.getHeader("Accept")).contains("application/json").contains("text/event-stream");
        assertThat(initialize.getHeader("Mcp-Session-Id")).isNull();
        JsonNode initBody = mapper.readTree(initialize.getBody().readUtf8());
        assertThat(initBody.path("method").asText()).isEqualTo("initialize");
        assertThat(initBody.path("params").path("clientInfo").path("name").asText()).isEqualTo("toolmesh");

        RecordedRequest initialized = server.takeRequest();
        JsonNode notification = mapper.readTree(initialized.getBody().readUtf8());
        assertThat(notification.path("method").asText()).isEqualTo("notifications/initialized");
        assertThat(notification.has("id")).isFalse();
        assertThat(initialized.getHeader("Mcp-Session-Id")).isEqualTo("session-7");

        RecordedRequest list = server.takeRequest();
        assertThat(list.getHeader("Mcp-Session-Id")).isEqualTo("session-7");
        assertThat(mapper.readTree(list.getBody().readUtf8()).path("method").asText()).isEqualTo("tools/list");
    }

    @Test
    void shouldReadResponseFromEventStreamSkippingNotifications() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                event: message
                data: {"jsonrpc":"2.0","method":"notifications/progress","params":{"progress":1}}

                event: message
                data: {"jsonrpc":"2.0","id":1,"result":{"content":[{"type":"text","text":"42 gwei"}]}}

                """));

        JsonNode result = transport.request("tools/call", Map.of("name", "gasPrice")).join();

        assertThat(result.path("content").get(0).path("text").asText()).isEqualTo("42 gwei");
    }

    @Test
    void shouldSurfaceJsonRpcErrors() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"jsonrpc":"2.0","id":1,"error":{"code":-32602,"message":"Invalid params: address"}}
                """));

        assertThatThrownBy(() -> transport.request("tools/call", Map.of()).join())
            .cause()
            .isInstanceOfSatisfying(McpTransportException.class, e -> {
                assertThat(e.rpcCode()).isEqualTo(-32602);
                assertThat(e.getMessage()).isEqualTo("Invalid params: address");
            });
    }

    @Test
    void shouldSurfaceHttpFailures() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> transport.request("tools/list", Map.of()).join())
            .cause()
            .isInstanceOfSatisfying(McpTransportException.class, e -> {
                assertThat(e.httpStatus()).isEqualTo(500);
                assertThat(e.getMessage()).contains("HTTP 500").contains("boom");
                assertThat(ErrorClassifier.kindOf(e, ErrorClassifier.Phase.CALL))
                    .isEqualTo(ToolErrorKind.SERVER_ERROR);
            });
    }

    @Test
    void closeShouldTerminateSessionAndTolerateUnsupportedDelete() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setHeader("Mcp-Session-Id", "session-9")
            .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}"));
        server.enqueue(new MockResponse().setResponseCode(202));
        server.enqueue(new MockResponse().setResponseCode(405));

        transport.connect().join();
        transport.close();

        server.takeRequest();
        server.takeRequest();
        RecordedRequest delete = server.takeRequest();
        assertThat(delete.getMethod()).isEqualTo("DELETE");
        assertThat(delete.getHeader("Mcp-Session-Id")).isEqualTo("session-9");
        assertThat(transport.sessionId()).isNull();
    }

    @Test
    void closeWithoutSessionShouldNotContactServer() throws Exception {
        transport.close();

        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void hangingSessionTeardownShouldNotStallOtherTimeouts() throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String body = request.getBody().readUtf8();
                if ("POST".equals(request.getMethod()) && body.contains("\"initialize\"")) {
                    return new MockResponse()
                        .setHeader("Content-Type", "application/json")
                        .setHeader("Mcp-Session-Id", "session-1")
                        .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}");
                }
                if (body.contains("notifications/initialized")) {
                    return new MockResponse().setResponseCode(202);
                }
                return new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE);
            }
        });
        OkHttpClient client = new OkHttpClient.Builder()
            .readTimeout(Duration.ZERO)
            .callTimeout(Duration.ZERO)
            .build();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        ToolCallPipeline pipeline = new ToolCallPipeline(scheduler);
        ServerRegistry registry = new ServerRegistry(
            HttpMcpTransport.factory(client, mapper), pipeline, new ConnectionSettings(300, 300), RetryPolicy.none());
        try {
            CompletableFuture<?> added = registry.addServer("chain", server.url("/mcp").toString(), "");

            assertThatThrownBy(() -> added.get(2, TimeUnit.SECONDS))
                .cause()
                .isInstanceOfSatisfying(ToolServerException.class,
                    e -> assertThat(e.kind()).isEqualTo(ToolErrorKind.TIMEOUT));
            assertThat(registry.hasServer("chain")).isFalse();

            CompletableFuture<Object> unrelated = pipeline.withTimeout(CompletableFuture::new, 200, "Unrelated call", "other");
            assertThatThrownBy(() -> unrelated.get(2, TimeUnit.SECONDS))
                .cause()
                .isInstanceOfSatisfying(ToolServerException.class,
                    e -> assertThat(e.kind()).isEqualTo(ToolErrorKind.TIMEOUT));
        } finally {
            registry.closeAll();
            scheduler.shutdownNow();
            client.dispatcher().executorService().shutdownNow();
        }
    }
}
