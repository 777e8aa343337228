package io.toolmesh.core.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * JSON-RPC channel to one MCP server. Futures complete on transport threads; implementations must not block the
 * caller.
 */
public interface McpTransport {

    CompletableFuture<JsonNode> connect();

    CompletableFuture<JsonNode> request(String method, Map<String, Object> params);

    /**
     * Releases the session. Teardown may run on the timeout scheduler, so this must return without waiting on the
     * server.
     */
    void close();
}
