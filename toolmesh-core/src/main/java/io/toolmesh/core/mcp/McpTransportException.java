package io.toolmesh.core.mcp;

import java.io.IOException;

public final class McpTransportException extends IOException {
    public static final int NO_STATUS = -1;
    public static final int NO_RPC_CODE = 0;

    private final int httpStatus;
    private final int rpcCode;

    public McpTransportException(String message, int httpStatus, int rpcCode) {
        super(message);
        this.httpStatus = httpStatus;
        this.rpcCode = rpcCode;
    }

    public static McpTransportException http(int status, String message) {
        return new McpTransportException(message, status, NO_RPC_CODE);
    }

    public static McpTransportException rpc(int code, String message) {
        return new McpTransportException(message, NO_STATUS, code);
    }

    public static McpTransportException protocol(String message) {
        return new McpTransportException(message, NO_STATUS, NO_RPC_CODE);
    }

    public int httpStatus() {
        return httpStatus;
    }

    public int rpcCode() {
        return rpcCode;
    }
}
