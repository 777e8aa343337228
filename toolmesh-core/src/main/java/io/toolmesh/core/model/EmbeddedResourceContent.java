package io.toolmesh.core.model;

import java.util.Map;

public record EmbeddedResourceContent(Map<String, Object> resource) implements ContentBlock {

    public EmbeddedResourceContent {
        resource = resource == null ? Map.of() : resource;
    }

    @Override
    public String type() {
        return "resource";
    }
}
