package io.toolmesh.core.model;

public record ImageContent(String data, String mimeType) implements ContentBlock {

    public ImageContent {
        data = data == null ? "" : data;
        mimeType = mimeType == null ? "application/octet-stream" : mimeType;
    }

    @Override
    public String type() {
        return "image";
    }
}
