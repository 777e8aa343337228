package io.toolmesh.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.cli.CallCommand;
import io.toolmesh.cli.ChatCommand;
import io.toolmesh.cli.CliContext;
import io.toolmesh.cli.OnboardCommand;
import io.toolmesh.cli.ServersCommand;
import io.toolmesh.cli.StatusCommand;
import io.toolmesh.cli.ToolmeshCliCommand;
import io.toolmesh.cli.ToolsCommand;
import io.toolmesh.core.admin.ToolAdminService;
import io.toolmesh.core.chat.ChatOrchestrator;
import io.toolmesh.core.chat.ChatSettings;
import io.toolmesh.core.config.ConfigPaths;
import io.toolmesh.core.config.ConfigService;
import io.toolmesh.core.config.model.AgentConfig;
import io.toolmesh.core.config.model.McpServerConfig;
import io.toolmesh.core.config.model.McpSettings;
import io.toolmesh.core.config.model.ProviderConfig;
import io.toolmesh.core.config.model.ToolmeshConfig;
import io.toolmesh.core.mcp.HttpMcpTransport;
import io.toolmesh.core.mcp.ServerBootstrapper;
import io.toolmesh.core.mcp.ServerEndpoint;
import io.toolmesh.core.mcp.ServerRegistry;
import io.toolmesh.core.mcp.ToolCallPipeline;
import io.toolmesh.core.provider.FallbackLlmGateway;
import io.toolmesh.core.provider.LlmGateway;
import io.toolmesh.core.provider.OpenAiCompatGateway;
import io.toolmesh.core.session.FileSessionStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ToolmeshApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ToolmeshApplication.class);

    private ToolmeshApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        ToolmeshConfig config = loadConfig(configService);
        AgentConfig agent = config.agent();
        McpSettings mcpSettings = config.mcp().settings();

        // Per-call deadlines come from the pipeline; the HTTP client only bounds the socket connect.
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofMillis(mcpSettings.connectionTimeout()))
            .readTimeout(Duration.ZERO)
            .callTimeout(Duration.ZERO)
            .build();
        ToolCallPipeline pipeline = new ToolCallPipeline();
        ServerRegistry registry = new ServerRegistry(
            HttpMcpTransport.factory(httpClient, new ObjectMapper()),
            pipeline,
            mcpSettings.toConnectionSettings(),
            mcpSettings.callRetryPolicy()
        );
        ServerBootstrapper bootstrapper = new ServerBootstrapper(registry, pipeline, mcpSettings.reconnectPolicy());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            bootstrapper.close();
            registry.closeAll();
            pipeline.close();
            // Session DELETEs are in flight on the dispatcher; give them a bounded window.
            httpClient.dispatcher().executorService().shutdown();
            try {
                httpClient.dispatcher().executorService().awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "toolmesh-shutdown"));

        ChatOrchestrator orchestrator = new ChatOrchestrator(
            buildGateway(agent.provider(), config),
            registry,
            new FileSessionStore(ConfigPaths.resolveSessionsDir(agent.sessionsDir())),
            new ChatSettings(agent.model(), agent.systemPrompt(), agent.maxToolRounds(), agent.temperature())
        );

        List<ServerEndpoint> endpoints = new ArrayList<>();
        for (McpServerConfig server : config.mcp().servers()) {
            endpoints.add(server.toEndpoint());
        }
        AtomicReference<ServerBootstrapper.StartupReport> started = new AtomicReference<>();
        CliContext context = new CliContext(
            orchestrator,
            new ToolAdminService(registry, bootstrapper),
            configService,
            ConfigPaths.defaultConfigPath(),
            () -> started.updateAndGet(report -> report != null ? report : bootstrapper.connectAll(endpoints).join())
        );

        CommandLine commandLine = new CommandLine(new ToolmeshCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("servers", new ServersCommand(context));
        commandLine.addSubcommand("tools", new ToolsCommand(context));
        commandLine.addSubcommand("call", new CallCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static ToolmeshConfig loadConfig(ConfigService configService) {
        try {
            return configService.load(ConfigPaths.defaultConfigPath());
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", ConfigPaths.defaultConfigPath(), e.getMessage());
            return ToolmeshConfig.defaults();
        }
    }

    private static LlmGateway buildGateway(String preferred, ToolmeshConfig config) {
        LlmGateway openrouter = buildOpenAiCompatGateway("openrouter", config.providers().openrouter(), "https://openrouter.ai/api/v1");
        LlmGateway openai = buildOpenAiCompatGateway("openai", config.providers().openai(), "https://api.openai.com/v1");
        List<LlmGateway> chain = "openai".equalsIgnoreCase(preferred)
            ? List.of(openai, openrouter)
            : List.of(openrouter, openai);
        return new FallbackLlmGateway(preferred == null ? "openrouter" : preferred, chain);
    }

    private static LlmGateway buildOpenAiCompatGateway(String name, ProviderConfig providerConfig, String defaultBase) {
        ProviderConfig provider = providerConfig == null ? ProviderConfig.defaults(defaultBase) : providerConfig;
        String apiBase = provider.apiBase() == null || provider.apiBase().isBlank() ? defaultBase : provider.apiBase();
        return new OpenAiCompatGateway(name, provider.apiKey(), apiBase, provider.extraHeaders());
    }
}
