package io.toolmesh.core.config;

import java.nio.file.Path;
import java.util.List;

public record OnboardResult(
    Path configPath,
    Path sessionsPath,
    boolean createdConfig,
    boolean overwrittenConfig,
    List<String> serverNames,
    String defaultServer
) {

    public OnboardResult {
        serverNames = serverNames == null ? List.of() : List.copyOf(serverNames);
        defaultServer = defaultServer == null ? "" : defaultServer;
    }

    public boolean defaultServerConfigured() {
        return defaultServer.isBlank() || serverNames.contains(defaultServer);
    }
}
