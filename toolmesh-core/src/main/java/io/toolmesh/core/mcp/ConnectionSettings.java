package io.toolmesh.core.mcp;

public record ConnectionSettings(long connectionTimeoutMs, long callTimeoutMs) {
    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    public ConnectionSettings {
        connectionTimeoutMs = connectionTimeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : connectionTimeoutMs;
        callTimeoutMs = callTimeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : callTimeoutMs;
    }

    public static ConnectionSettings defaults() {
        return new ConnectionSettings(DEFAULT_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
    }
}
