package io.toolmesh.core.model;

public interface ContentBlock {
    String type();
}
