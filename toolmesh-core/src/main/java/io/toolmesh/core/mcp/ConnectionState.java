package io.toolmesh.core.mcp;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    READY,
    FAILED
}
