package io.toolmesh.core.admin;

import java.util.List;

public record AddedServer(String server, String url, String description, List<ToolView> tools) {
}
