package io.toolmesh.core.chat;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.model.EmbeddedResourceContent;
import io.toolmesh.core.model.ImageContent;
import io.toolmesh.core.model.TextContent;
import io.toolmesh.core.model.ToolErrorKind;
import io.toolmesh.core.model.ToolResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolResultRendererTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ToolResultRenderer renderer = new ToolResultRenderer(mapper);

    @Test
    void shouldJoinBlocksLineByLine() {
        ToolResult result = ToolResult.ok(List.of(
            new TextContent("Gas: 42 gwei"),
            new ImageContent("aGVsbG8=", "image/png"),
            new EmbeddedResourceContent(Map.of("uri", "file:///report.txt"))
        ));

        assertThat(renderer.render(result)).isEqualTo(
            "Gas: 42 gwei\n"
                + "[image: image/png, 8 base64 chars]\n"
                + "[embedded resource: {\"uri\":\"file:///report.txt\"}]"
        );
    }

    @Test
    void emptyResultShouldRenderEmpty() {
        assertThat(renderer.render(ToolResult.ok(List.of()))).isEmpty();
    }

    @Test
    void errorShouldRenderAsJsonObject() throws Exception {
        JsonNode rendered = mapper.readTree(renderer.render(ToolResult.error(ToolErrorKind.TIMEOUT, "Tool call 'gasPrice' (timeout after 30000ms)")));

        assertThat(rendered.path("error").path("kind").asText()).isEqualTo("TIMEOUT");
        assertThat(rendered.path("error").path("message").asText()).contains("timeout after 30000ms");
    }

    @Test
    void errorShouldCarryExtraFields() throws Exception {
        ToolResult result = ToolResult.error(ToolErrorKind.INVALID_ARGS, "bad json");

        JsonNode rendered = mapper.readTree(renderer.renderError(result.error(), Map.of("originalArguments", "{oops")));

        assertThat(rendered.path("error").path("originalArguments").asText()).isEqualTo("{oops");
    }
}
