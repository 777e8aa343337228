package io.toolmesh.core.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.model.EmbeddedResourceContent;
import io.toolmesh.core.model.ImageContent;
import io.toolmesh.core.model.TextContent;
import io.toolmesh.core.model.ToolDescriptor;
import io.toolmesh.core.model.ToolErrorKind;
import io.toolmesh.core.model.ToolResult;
import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ToolServerConnectionTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final ToolCallPipeline pipeline = new ToolCallPipeline(scheduler);

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldBecomeReadyAndCacheCatalog() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).tool("gasPrice", "42 gwei").tool("balance", "1 ETH");
        ToolServerConnection connection = connection(transport, ConnectionSettings.defaults());

        List<ToolDescriptor> tools = connection.initialize().join();

        assertThat(connection.state()).isEqualTo(ConnectionState.READY);
        assertThat(tools).extracting(ToolDescriptor::qualifiedName).containsExactly("chain__gasPrice", "chain__balance");
        assertThat(tools.get(0).inputSchema()).containsEntry("type", "object");
        assertThat(connection.listTools()).isEqualTo(tools);
    }

    @Test
    void initializeShouldBeIdempotent() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).tool("gasPrice", "42 gwei");
        ToolServerConnection connection = connection(transport, ConnectionSettings.defaults());

        connection.initialize().join();
        connection.initialize().join();

        assertThat(transport.connects()).isEqualTo(1);
    }

    @Test
    void shouldSkipUnaddressableAndDuplicateToolNames() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler)
            .tool("gasPrice", "42 gwei")
            .advertise("bad__name")
            .advertise("gasPrice");
        ToolServerConnection connection = connection(transport, ConnectionSettings.defaults());

        List<ToolDescriptor> tools = connection.initialize().join();

        assertThat(tools).extracting(ToolDescriptor::name).containsExactly("gasPrice");
    }

    @Test
    void shouldFollowCatalogPages() {
        PagedTransport transport = new PagedTransport();
        ToolServerConnection connection = new ToolServerConnection(
            "paged", "http://paged", "", transport, pipeline, ConnectionSettings.defaults());

        List<ToolDescriptor> tools = connection.initialize().join();

        assertThat(tools).extracting(ToolDescriptor::name).containsExactly("first", "second");
        assertThat(transport.cursors).containsExactly("", "page-2");
    }

    @Test
    void failedInitializeShouldResetStateAndCloseTransport() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).failConnect(new ConnectException("Connection refused"));
        ToolServerConnection connection = connection(transport, ConnectionSettings.defaults());

        assertThatThrownBy(() -> connection.initialize().join())
            .isInstanceOf(CompletionException.class)
            .cause()
            .isInstanceOfSatisfying(ToolServerException.class, e -> {
                assertThat(e.kind()).isEqualTo(ToolErrorKind.CONNECTION);
                assertThat(e.serverId()).isEqualTo("chain");
                assertThat(e.getMessage()).startsWith("MCP client initialization error: ");
            });
        assertThat(connection.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(connection.listTools()).isEmpty();
        assertThat(transport.closes()).isEqualTo(1);
    }

    @Test
    void hangingHandshakeShouldTimeOutWithinConnectionTimeout() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).hangConnect();
        ToolServerConnection connection = connection(transport, new ConnectionSettings(100, 1_000));

        assertThatThrownBy(() -> connection.initialize().join())
            .cause()
            .isInstanceOfSatisfying(ToolServerException.class, e -> {
                assertThat(e.kind()).isEqualTo(ToolErrorKind.TIMEOUT);
                assertThat(e.getMessage()).contains("(timeout after 100ms)");
            });
        assertThat(connection.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void callShouldReturnContentBlocks() {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode mixed = mapper.createObjectNode()
            .set("content", mapper.createArrayNode()
                .add(mapper.createObjectNode().put("type", "text").put("text", "hello"))
                .add(mapper.createObjectNode().put("type", "image").put("data", "AAAA").put("mimeType", "image/png"))
                .add(mapper.createObjectNode().put("type", "resource")
                    .set("resource", mapper.createObjectNode().put("uri", "file:///a.txt"))));
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).script("mixed", FakeMcpTransport.Outcome.raw(mixed));
        ToolServerConnection connection = ready(transport);

        ToolResult result = connection.call("mixed", Map.of("q", 1)).join();

        assertThat(result.isOk()).isTrue();
        assertThat(result.content()).hasSize(3);
        assertThat(result.content().get(0)).isEqualTo(new TextContent("hello"));
        assertThat(result.content().get(1)).isEqualTo(new ImageContent("AAAA", "image/png"));
        assertThat(result.content().get(2)).isInstanceOfSatisfying(EmbeddedResourceContent.class,
            block -> assertThat(block.resource()).containsEntry("uri", "file:///a.txt"));
        assertThat(transport.callArguments()).containsExactly(Map.of("q", 1));
    }

    @Test
    void unknownToolShouldFailWithoutNetworkRoundTrip() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).tool("gasPrice", "42 gwei");
        ToolServerConnection connection = ready(transport);
        int requestsAfterInit = transport.requests();

        ToolResult result = connection.call("nope", Map.of()).join();

        assertThat(result.error().kind()).isEqualTo(ToolErrorKind.TOOL_NOT_FOUND);
        assertThat(transport.requests()).isEqualTo(requestsAfterInit);
    }

    @Test
    void callBeforeInitializeShouldReportConnectionError() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).tool("gasPrice", "42 gwei");
        ToolServerConnection connection = connection(transport, ConnectionSettings.defaults());

        ToolResult result = connection.call("gasPrice", Map.of()).join();

        assertThat(result.error().kind()).isEqualTo(ToolErrorKind.CONNECTION);
        assertThat(transport.requests()).isZero();
    }

    @Test
    void connectionResetShouldBecomeErrorValue() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler)
            .script("gasPrice", FakeMcpTransport.Outcome.fail(new IOException("Connection reset by peer")));
        ToolServerConnection connection = ready(transport);

        CompletableFuture<ToolResult> future = connection.call("gasPrice", Map.of());

        assertThat(future.join().error().kind()).isEqualTo(ToolErrorKind.CONNECTION);
        assertThat(future).isCompleted().isNotCompletedExceptionally();
    }

    @Test
    void slowToolShouldTimeOutAsErrorValue() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).script("gasPrice", FakeMcpTransport.Outcome.hangs());
        ToolServerConnection connection = connection(transport, new ConnectionSettings(1_000, 80));
        connection.initialize().join();

        ToolResult result = connection.call("gasPrice", Map.of()).join();

        assertThat(result.error().kind()).isEqualTo(ToolErrorKind.TIMEOUT);
        assertThat(result.error().message()).isEqualTo("Tool call 'gasPrice' (timeout after 80ms)");
    }

    @Test
    void toolLevelErrorShouldBeClassifiedFromItsText() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler)
            .script("transfer", FakeMcpTransport.Outcome.toolError("Invalid argument: amount must be positive"))
            .script("explode", FakeMcpTransport.Outcome.toolError("kaboom"));
        ToolServerConnection connection = ready(transport);

        assertThat(connection.call("transfer", Map.of()).join().error().kind()).isEqualTo(ToolErrorKind.INVALID_ARGS);
        assertThat(connection.call("explode", Map.of()).join().error())
            .satisfies(error -> {
                assertThat(error.kind()).isEqualTo(ToolErrorKind.SERVER_ERROR);
                assertThat(error.message()).isEqualTo("kaboom");
            });
    }

    @Test
    void closeShouldBeIdempotentAndDropCatalog() {
        FakeMcpTransport transport = new FakeMcpTransport(scheduler).tool("gasPrice", "42 gwei");
        ToolServerConnection connection = ready(transport);

        connection.close();
        connection.close();

        assertThat(connection.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(connection.listTools()).isEmpty();
        assertThat(transport.closes()).isEqualTo(1);
        assertThat(connection.call("gasPrice", Map.of()).join().error().kind()).isEqualTo(ToolErrorKind.CONNECTION);
    }

    private ToolServerConnection ready(FakeMcpTransport transport) {
        ToolServerConnection connection = connection(transport, ConnectionSettings.defaults());
        connection.initialize().join();
        return connection;
    }

    private ToolServerConnection connection(FakeMcpTransport transport, ConnectionSettings settings) {
        return new ToolServerConnection("chain", "http://chain.test/mcp", "chain tools", transport, pipeline, settings);
    }

    private static final class PagedTransport implements McpTransport {
        private final List<String> cursors = new ArrayList<>();

        @Override
        public CompletableFuture<JsonNode> connect() {
            return CompletableFuture.completedFuture(JSON.createObjectNode());
        }

        @Override
        public CompletableFuture<JsonNode> request(String method, Map<String, Object> params) {
            String cursor = String.valueOf(params.getOrDefault("cursor", ""));
            cursors.add(cursor);
            if (cursor.isEmpty()) {
                return CompletableFuture.completedFuture(JSON.createObjectNode()
                    .put("nextCursor", "page-2")
                    .set("tools", JSON.createArrayNode().add(JSON.createObjectNode().put("name", "first"))));
            }
            return CompletableFuture.completedFuture(JSON.createObjectNode()
                .set("tools", JSON.createArrayNode().add(JSON.createObjectNode().put("name", "second"))));
        }

        @Override
        public void close() {
        }
    }
}
