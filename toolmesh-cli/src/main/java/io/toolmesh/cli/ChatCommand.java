package io.toolmesh.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.admin.AddedServer;
import io.toolmesh.core.admin.AdminResponse;
import io.toolmesh.core.admin.ToolView;
import io.toolmesh.core.chat.ChatRequest;
import io.toolmesh.core.chat.ToolResultRenderer;
import io.toolmesh.core.model.ChatReply;
import io.toolmesh.core.model.ToolResult;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Chat with the LLM using tools from connected MCP servers")
public final class ChatCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String HELP = "Commands: /servers, /tools [server], /add <name> <url> [description], "
        + "/remove <name>, /call <server__tool> [json], /quit";

    private final CliContext context;
    private final ToolResultRenderer renderer = new ToolResultRenderer(JSON);

    @Parameters(index = "0", arity = "0..1", description = "Prompt to send; omit for an interactive session")
    String prompt;

    @Option(names = {"-s", "--session"}, description = "Continue an existing session")
    String sessionId;

    @Option(names = "--no-tools", description = "Do not offer MCP tools to the model")
    boolean noTools;

    @Option(names = {"-v", "--verbose"}, description = "Print each tool invocation")
    boolean verbose;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CliPrinter.printStartup(context.serverStartup().connect(), System.err);
            if (prompt != null && !prompt.isBlank()) {
                send(prompt);
                return 0;
            }
            return interactive();
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private int interactive() throws IOException {
        System.out.println("toolmesh chat. " + HELP);
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (true) {
            System.out.print("> ");
            System.out.flush();
            String line = reader.readLine();
            if (line == null) {
                return 0;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.equals("/quit") || line.equals("/exit")) {
                return 0;
            }
            try {
                if (line.startsWith("/")) {
                    runSlashCommand(line);
                } else {
                    send(line);
                }
            } catch (Exception e) {
                System.err.println("Error: " + e.getMessage());
            }
        }
    }

    private void send(String message) {
        ChatRequest request = new ChatRequest(sessionId, message, null, !noTools, false);
        ChatReply reply = context.orchestrator().chat(request).join();
        sessionId = reply.sessionId();
        if (verbose) {
            reply.invocations().forEach(invocation -> System.err.println(
                "[tool] " + invocation.qualifiedName()
                    + (invocation.result().isError() ? " failed (" + invocation.errorKind() + ")" : " ok")
                    + " in " + invocation.duration().toMillis() + "ms"
            ));
        }
        if (reply.roundLimitReached()) {
            System.err.println("[stopped after " + reply.rounds() + " tool rounds]");
        }
        System.out.println(reply.content());
    }

    private void runSlashCommand(String line) throws IOException {
        String[] parts = line.split("\\s+", 4);
        switch (parts[0]) {
            case "/servers" -> CliPrinter.printServers(context.admin().listServers().data(), System.out);
            case "/tools" -> {
                AdminResponse<List<ToolView>> tools = context.admin().listTools(parts.length > 1 ? parts[1] : null);
                if (tools.success()) {
                    CliPrinter.printTools(tools.data(), System.out);
                } else {
                    System.err.println(CliPrinter.errorText(tools));
                }
            }
            case "/add" -> {
                if (parts.length < 3) {
                    System.err.println("Usage: /add <name> <url> [description]");
                    return;
                }
                AdminResponse<AddedServer> added = context.admin()
                    .addServer(parts[1], parts[2], parts.length > 3 ? parts[3] : "")
                    .join();
                System.out.println(added.success() ? added.message() : CliPrinter.errorText(added));
            }
            case "/remove" -> {
                if (parts.length < 2) {
                    System.err.println("Usage: /remove <name>");
                    return;
                }
                AdminResponse<Boolean> removed = context.admin().removeServer(parts[1]);
                System.out.println(removed.success() ? removed.message() : CliPrinter.errorText(removed));
            }
            case "/call" -> {
                if (parts.length < 2) {
                    System.err.println("Usage: /call <server__tool> [json]");
                    return;
                }
                String rawArgs = line.substring(line.indexOf(parts[1]) + parts[1].length()).trim();
                Map<String, Object> arguments = rawArgs.isEmpty() ? Map.of() : JSON.readValue(rawArgs, MAP_TYPE);
                AdminResponse<ToolResult> result = context.admin().callTool(context.qualifyToolName(parts[1]), arguments).join();
                System.out.println(result.success() ? renderer.render(result.data()) : CliPrinter.errorText(result));
            }
            default -> System.err.println("Unknown command " + parts[0] + ". " + HELP);
        }
    }
}
