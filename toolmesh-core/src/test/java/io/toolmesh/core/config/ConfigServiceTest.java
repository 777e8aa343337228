package io.toolmesh.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.toolmesh.core.config.model.McpServerConfig;
import io.toolmesh.core.config.model.ToolmeshConfig;
import io.toolmesh.core.mcp.RetryPolicy;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        ToolmeshConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.agent().model()).isEqualTo("openai/gpt-4o-mini");
        assertThat(config.agent().maxToolRounds()).isEqualTo(5);
        assertThat(config.providers().openrouter().configured()).isFalse();
        assertThat(config.mcp().servers()).isEmpty();
        assertThat(config.mcp().settings().connectionTimeout()).isEqualTo(30_000);
    }

    @Test
    void shouldMergeFileOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agent": { "model": "openai/gpt-4.1" },
              "providers": { "openrouter": { "apiKey": "sk-test" } },
              "mcp": {
                "servers": [
                  { "name": "chain", "url": "http://localhost:3001/mcp", "description": "Blockchain tools" }
                ],
                "settings": { "max_retries": 4, "callTimeout": 5000 }
              }
            }
            """);

        ToolmeshConfig config = service.load(configPath);

        assertThat(config.agent().model()).isEqualTo("openai/gpt-4.1");
        assertThat(config.agent().temperature()).isEqualTo(0.7);
        assertThat(config.providers().openrouter().apiKey()).isEqualTo("sk-test");
        assertThat(config.providers().openrouter().apiBase()).isEqualTo("https://openrouter.ai/api/v1");
        assertThat(config.providers().openai().configured()).isFalse();
        assertThat(config.mcp().servers()).containsExactly(
            new McpServerConfig("chain", "http://localhost:3001/mcp", "Blockchain tools"));
        assertThat(config.mcp().settings().maxRetries()).isEqualTo(4);
        assertThat(config.mcp().settings().callTimeout()).isEqualTo(5_000);
        assertThat(config.mcp().settings().connectionTimeout()).isEqualTo(30_000);
        assertThat(config.mcp().settings().callRetryPolicy()).isEqualTo(RetryPolicy.fixed(5, 1_000));
    }

    @Test
    void onboardShouldKeepExistingValuesAndCreateSessionsDirectory() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".toolmesh/config.json");
        Path sessions = tempDir.resolve("sessions");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{\"agent\":{\"model\":\"m\",\"sessionsDir\":\"" + sessions.toString().replace("\\", "\\\\") + "\"}}");

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(result.sessionsPath()).isEqualTo(sessions);
        assertThat(Files.isDirectory(sessions)).isTrue();
        assertThat(service.load(configPath).agent().model()).isEqualTo("m");
        assertThat(Files.readString(configPath)).contains("\"connectionTimeout\"");
    }

    @Test
    void sessionsDirShouldExpandHome() {
        Path resolved = ConfigPaths.resolveSessionsDir("~/.toolmesh/sessions");

        assertThat(resolved).isEqualTo(Path.of(System.getProperty("user.home"), ".toolmesh", "sessions"));
    }

    @Test
    void relativeSessionsDirShouldResolveUnderToolmeshHome() {
        Path home = tempDir.resolve("home");

        assertThat(ConfigPaths.resolveSessionsDir("archive", home)).isEqualTo(home.resolve("archive"));
        assertThat(ConfigPaths.resolveSessionsDir(" ", home)).isEqualTo(home.resolve("sessions"));
        assertThat(ConfigPaths.resolveSessionsDir("~", home)).isEqualTo(Path.of(System.getProperty("user.home")));
    }

    @Test
    void toolmeshHomeShouldFollowSystemProperty() {
        String previous = System.getProperty(ConfigPaths.HOME_PROPERTY);
        try {
            System.setProperty(ConfigPaths.HOME_PROPERTY, tempDir.toString());

            assertThat(ConfigPaths.toolmeshHome()).isEqualTo(tempDir);
            assertThat(ConfigPaths.defaultConfigPath()).isEqualTo(tempDir.resolve("config.json"));
        } finally {
            if (previous == null) {
                System.clearProperty(ConfigPaths.HOME_PROPERTY);
            } else {
                System.setProperty(ConfigPaths.HOME_PROPERTY, previous);
            }
        }
    }

    @Test
    void onboardShouldReportConfiguredServersAndUnknownDefault() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Path sessions = tempDir.resolve("sessions");
        Files.writeString(configPath, "{\"agent\":{\"sessionsDir\":\"" + sessions.toString().replace("\\", "\\\\") + "\"},"
            + "\"mcp\":{\"servers\":[{\"name\":\"chain\",\"url\":\"http://localhost:3001/mcp\"}],"
            + "\"settings\":{\"defaultServer\":\"wallet\"}}}");

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.serverNames()).containsExactly("chain");
        assertThat(result.defaultServer()).isEqualTo("wallet");
        assertThat(result.defaultServerConfigured()).isFalse();
    }
}
