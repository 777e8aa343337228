package io.toolmesh.core.mcp;

import io.toolmesh.core.model.ToolErrorKind;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ErrorClassifier {

    public enum Phase {
        INITIALIZE,
        CALL
    }

    private ErrorClassifier() {
    }

    public static ToolServerException classify(Throwable error, Phase phase, String serverId, String toolName) {
        Throwable cause = unwrap(error);
        if (cause instanceof ToolServerException classified) {
            return classified;
        }
        String message = messageOf(cause);
        String prefix = phase == Phase.INITIALIZE ? "MCP client initialization error: " : "Tool call error: ";
        return new ToolServerException(kindOf(cause, phase), prefix + message, serverId, toolName, cause);
    }

    public static ToolErrorKind kindOf(Throwable error, Phase phase) {
        Throwable cause = unwrap(error);
        if (cause instanceof ToolServerException classified) {
            return classified.kind();
        }
        if (cause instanceof SocketTimeoutException) {
            return ToolErrorKind.TIMEOUT;
        }
        if (cause instanceof McpTransportException remote) {
            ToolErrorKind structured = fromRemote(remote);
            return structured == ToolErrorKind.UNKNOWN ? fromMessage(remote.getMessage(), phase) : structured;
        }
        ToolErrorKind kind = fromMessage(messageOf(cause), phase);
        if (kind == ToolErrorKind.UNKNOWN && cause instanceof IOException) {
            return ToolErrorKind.CONNECTION;
        }
        return kind;
    }

    public static ToolErrorKind fromMessage(String message, Phase phase) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (text.contains("timeout") || text.contains("timed out")) {
            return ToolErrorKind.TIMEOUT;
        }
        if (phase == Phase.CALL) {
            if (text.contains("not found") || text.contains("unknown tool")) {
                return ToolErrorKind.TOOL_NOT_FOUND;
            }
            if (text.contains("argument") || text.contains("parameter")) {
                return ToolErrorKind.INVALID_ARGS;
            }
        }
        if (text.contains("connect") || text.contains("refused") || text.contains("reset")) {
            return ToolErrorKind.CONNECTION;
        }
        if (text.contains("server") || text.contains("internal")) {
            return ToolErrorKind.SERVER_ERROR;
        }
        return ToolErrorKind.UNKNOWN;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String messageOf(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private static ToolErrorKind fromRemote(McpTransportException remote) {
        ToolErrorKind byCode = switch (remote.rpcCode()) {
            case -32601 -> ToolErrorKind.TOOL_NOT_FOUND;
            case -32602 -> ToolErrorKind.INVALID_ARGS;
            case -32603 -> ToolErrorKind.SERVER_ERROR;
            default -> null;
        };
        if (byCode != null) {
            return byCode;
        }
        int status = remote.httpStatus();
        if (status >= 500) {
            return ToolErrorKind.SERVER_ERROR;
        }
        if (status == 401 || status == 403 || status == 404) {
            return ToolErrorKind.CONNECTION;
        }
        return ToolErrorKind.UNKNOWN;
    }
}
