package io.toolmesh.core.provider;

public class LlmGatewayException extends RuntimeException {
    private final String gateway;
    private final int httpStatus;

    public LlmGatewayException(String gateway, String message) {
        this(gateway, message, -1, null);
    }

    public LlmGatewayException(String gateway, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.gateway = gateway;
        this.httpStatus = httpStatus;
    }

    public String gateway() {
        return gateway;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
