package io.toolmesh.core.admin;

public record ServerView(String id, int toolCount, String description, String state) {
}
