package io.toolmesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.toolmesh.core.mcp.ConnectionSettings;
import io.toolmesh.core.mcp.RetryPolicy;

// Durations in milliseconds. maxRetries counts retries after the first call.
@JsonIgnoreProperties(ignoreUnknown = true)
public record McpSettings(
    @JsonAlias({"default_server"}) String defaultServer,
    @JsonAlias({"connection_timeout"}) long connectionTimeout,
    @JsonAlias({"call_timeout"}) long callTimeout,
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"retry_interval"}) long retryInterval,
    @JsonAlias({"reconnect_interval"}) long reconnectInterval,
    @JsonAlias({"max_reconnect_attempts"}) int maxReconnectAttempts
) {

    public static McpSettings defaults() {
        return new McpSettings("", 30_000, 30_000, 2, 1_000, 30_000, 10);
    }

    public ConnectionSettings toConnectionSettings() {
        return new ConnectionSettings(connectionTimeout, callTimeout);
    }

    public RetryPolicy callRetryPolicy() {
        return RetryPolicy.fixed(Math.max(0, maxRetries) + 1, retryInterval);
    }

    public RetryPolicy reconnectPolicy() {
        return RetryPolicy.fixed(Math.max(0, maxReconnectAttempts) + 1, reconnectInterval);
    }
}
