package io.toolmesh.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    static final String HOME_PROPERTY = "toolmesh.home";
    static final String HOME_ENV = "TOOLMESH_HOME";
    private static final String CONFIG_FILE = "config.json";
    private static final String SESSIONS_DIR = "sessions";

    private ConfigPaths() {
    }

    // -Dtoolmesh.home wins over TOOLMESH_HOME; both fall back to ~/.toolmesh.
    public static Path toolmeshHome() {
        String configured = System.getProperty(HOME_PROPERTY);
        if (configured == null || configured.isBlank()) {
            configured = System.getenv(HOME_ENV);
        }
        if (configured == null || configured.isBlank()) {
            return userHome().resolve(".toolmesh");
        }
        return expandUserHome(configured);
    }

    public static Path defaultConfigPath() {
        return toolmeshHome().resolve(CONFIG_FILE);
    }

    public static Path resolveSessionsDir(String rawPath) {
        return resolveSessionsDir(rawPath, toolmeshHome());
    }

    // Relative session directories live under the toolmesh home, not the working directory.
    static Path resolveSessionsDir(String rawPath, Path home) {
        if (rawPath == null || rawPath.isBlank()) {
            return home.resolve(SESSIONS_DIR);
        }
        Path expanded = expandUserHome(rawPath.trim());
        return expanded.isAbsolute() ? expanded : home.resolve(expanded);
    }

    private static Path expandUserHome(String rawPath) {
        if (rawPath.equals("~")) {
            return userHome();
        }
        if (rawPath.startsWith("~/")) {
            return userHome().resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    private static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }
}
