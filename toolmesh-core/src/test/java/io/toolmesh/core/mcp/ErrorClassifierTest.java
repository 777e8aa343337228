package io.toolmesh.core.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import io.toolmesh.core.model.ToolErrorKind;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class ErrorClassifierTest {

    @Test
    void shouldClassifyMessagesBySubstring() {
        assertThat(ErrorClassifier.fromMessage("Request timed out", ErrorClassifier.Phase.CALL)).isEqualTo(ToolErrorKind.TIMEOUT);
        assertThat(ErrorClassifier.fromMessage("Tool not found: x", ErrorClassifier.Phase.CALL)).isEqualTo(ToolErrorKind.TOOL_NOT_FOUND);
        assertThat(ErrorClassifier.fromMessage("Missing argument 'a'", ErrorClassifier.Phase.CALL)).isEqualTo(ToolErrorKind.INVALID_ARGS);
        assertThat(ErrorClassifier.fromMessage("ECONNREFUSED", ErrorClassifier.Phase.CALL)).isEqualTo(ToolErrorKind.CONNECTION);
        assertThat(ErrorClassifier.fromMessage("Internal failure", ErrorClassifier.Phase.CALL)).isEqualTo(ToolErrorKind.SERVER_ERROR);
        assertThat(ErrorClassifier.fromMessage("something odd", ErrorClassifier.Phase.CALL)).isEqualTo(ToolErrorKind.UNKNOWN);
    }

    @Test
    void toolSpecificKindsOnlyApplyToCalls() {
        assertThat(ErrorClassifier.fromMessage("endpoint not found", ErrorClassifier.Phase.INITIALIZE))
            .isEqualTo(ToolErrorKind.UNKNOWN);
        assertThat(ErrorClassifier.fromMessage("bad parameter", ErrorClassifier.Phase.INITIALIZE))
            .isEqualTo(ToolErrorKind.UNKNOWN);
    }

    @Test
    void shouldPreferStructuredSignals() {
        assertThat(ErrorClassifier.kindOf(McpTransportException.rpc(-32602, "whatever"), ErrorClassifier.Phase.CALL))
            .isEqualTo(ToolErrorKind.INVALID_ARGS);
        assertThat(ErrorClassifier.kindOf(McpTransportException.rpc(-32601, "whatever"), ErrorClassifier.Phase.CALL))
            .isEqualTo(ToolErrorKind.TOOL_NOT_FOUND);
        assertThat(ErrorClassifier.kindOf(McpTransportException.http(503, "unavailable"), ErrorClassifier.Phase.CALL))
            .isEqualTo(ToolErrorKind.SERVER_ERROR);
        assertThat(ErrorClassifier.kindOf(McpTransportException.http(404, "gone"), ErrorClassifier.Phase.INITIALIZE))
            .isEqualTo(ToolErrorKind.CONNECTION);
        assertThat(ErrorClassifier.kindOf(new SocketTimeoutException("read"), ErrorClassifier.Phase.CALL))
            .isEqualTo(ToolErrorKind.TIMEOUT);
        assertThat(ErrorClassifier.kindOf(new IOException("stream closed"), ErrorClassifier.Phase.CALL))
            .isEqualTo(ToolErrorKind.CONNECTION);
    }

    @Test
    void shouldUnwrapAndPrefixMessages() {
        ToolServerException classified = ErrorClassifier.classify(
            new CompletionException(new IOException("Connection reset")), ErrorClassifier.Phase.INITIALIZE, "s1", null);

        assertThat(classified.kind()).isEqualTo(ToolErrorKind.CONNECTION);
        assertThat(classified.serverId()).isEqualTo("s1");
        assertThat(classified.getMessage()).isEqualTo("MCP client initialization error: Connection reset");
    }

    @Test
    void shouldKeepAlreadyClassifiedErrors() {
        ToolServerException original = new ToolServerException(ToolErrorKind.TIMEOUT, "slow", "s1", "t");

        assertThat(ErrorClassifier.classify(new CompletionException(original), ErrorClassifier.Phase.CALL, "other", null))
            .isSameAs(original);
    }
}
