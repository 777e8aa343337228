package io.toolmesh.core.model;

public record TextContent(String text) implements ContentBlock {

    public TextContent {
        text = text == null ? "" : text;
    }

    @Override
    public String type() {
        return "text";
    }
}
