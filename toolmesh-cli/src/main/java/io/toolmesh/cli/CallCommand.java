package io.toolmesh.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.admin.AdminResponse;
import io.toolmesh.core.chat.ToolResultRenderer;
import io.toolmesh.core.model.ToolResult;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "call", description = "Call one tool directly, bypassing the LLM")
public final class CallCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Tool name, serverId__toolName or a bare name on mcp.settings.defaultServer")
    String tool;

    @Option(names = {"-a", "--args"}, description = "Tool arguments as a JSON object", defaultValue = "{}")
    String arguments;

    public CallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Map<String, Object> parsed = JSON.readValue(arguments, MAP_TYPE);
            CliPrinter.printStartup(context.serverStartup().connect(), System.err);
            AdminResponse<ToolResult> response = context.admin().callTool(context.qualifyToolName(tool), parsed).join();
            if (!response.success()) {
                System.err.println("Call command failed: " + CliPrinter.errorText(response));
                return 1;
            }
            System.out.println(new ToolResultRenderer(JSON).render(response.data()));
            return 0;
        } catch (Exception e) {
            System.err.println("Call command failed: " + e.getMessage());
            return 1;
        }
    }
}
