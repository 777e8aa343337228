package io.toolmesh.core.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.mcp.ErrorClassifier;
import io.toolmesh.core.mcp.ServerRegistry;
import io.toolmesh.core.mcp.ToolServerException;
import io.toolmesh.core.model.ChatMessage;
import io.toolmesh.core.model.ChatReply;
import io.toolmesh.core.model.MessageRole;
import io.toolmesh.core.model.ToolCall;
import io.toolmesh.core.model.ToolDescriptor;
import io.toolmesh.core.model.ToolInvocation;
import io.toolmesh.core.model.ToolResult;
import io.toolmesh.core.provider.LlmCompletion;
import io.toolmesh.core.provider.LlmGateway;
import io.toolmesh.core.provider.LlmRequest;
import io.toolmesh.core.session.Session;
import io.toolmesh.core.session.SessionStore;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ChatOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(ChatOrchestrator.class);
    private static final String DEGRADED_PREFIX = "Sorry, I ran into a problem while processing your request: ";
    private static final int SUMMARY_OUTPUT_LIMIT = 200;

    private final LlmGateway gateway;
    private final ServerRegistry registry;
    private final SessionStore sessionStore;
    private final ChatSettings settings;
    private final ToolArgumentParser argumentParser;
    private final ToolResultRenderer renderer;

    public ChatOrchestrator(LlmGateway gateway, ServerRegistry registry, SessionStore sessionStore, ChatSettings settings) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        ObjectMapper mapper = new ObjectMapper();
        this.argumentParser = new ToolArgumentParser(mapper);
        this.renderer = new ToolResultRenderer(mapper);
    }

    public CompletableFuture<ChatReply> chat(ChatRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("message must not be blank"));
        }

        String systemPrompt = request.systemPrompt() == null ? settings.systemPrompt() : request.systemPrompt();
        Turn turn = openTurn(request.sessionId(), systemPrompt);
        ChatMessage userMessage = ChatMessage.user(request.message());
        turn.transcript.add(userMessage);
        persist(turn, userMessage);

        List<Map<String, Object>> tools = request.enableTools() ? toolDefinitions() : List.of();
        LOG.debug("Chat turn in session {} with {} tools available", turn.sessionId, tools.size());
        return nextRound(turn, tools).thenApply(message -> new ChatReply(
            turn.sessionId,
            message,
            turn.invocations,
            turn.rounds,
            turn.roundLimitReached,
            request.includeHistory() ? turn.transcript : List.of()
        ));
    }

    private CompletableFuture<ChatMessage> nextRound(Turn turn, List<Map<String, Object>> tools) {
        LlmRequest llmRequest = new LlmRequest(
            settings.model(),
            turn.transcript,
            tools,
            tools.isEmpty() ? null : "auto",
            settings.temperature()
        );

        CompletableFuture<LlmCompletion> completion;
        try {
            completion = gateway.complete(llmRequest);
        } catch (RuntimeException e) {
            completion = CompletableFuture.failedFuture(e);
        }

        return completion.<CompletableFuture<ChatMessage>>handle((response, error) -> {
            if (error != null) {
                String reason = ErrorClassifier.messageOf(error);
                LOG.warn("LLM gateway {} failed in session {}: {}", gateway.name(), turn.sessionId, reason);
                return CompletableFuture.completedFuture(finish(turn, DEGRADED_PREFIX + reason));
            }
            if (!response.hasToolCalls()) {
                return CompletableFuture.completedFuture(finish(turn, response.content()));
            }

            turn.rounds++;
            if (!response.content().isBlank()) {
                turn.lastAssistantText = response.content();
            }
            ChatMessage toolRequest = ChatMessage.assistantWithToolCalls(response.content(), response.toolCalls());
            turn.transcript.add(toolRequest);
            persist(turn, toolRequest);

            return runToolCalls(turn, response.toolCalls()).<ChatMessage>thenCompose(ignored -> {
                if (turn.rounds >= settings.maxToolRounds()) {
                    LOG.warn("Session {} reached the limit of {} tool rounds", turn.sessionId, settings.maxToolRounds());
                    turn.roundLimitReached = true;
                    return CompletableFuture.completedFuture(finish(turn, partialContent(turn)));
                }
                return nextRound(turn, tools);
            });
        }).thenCompose(next -> next);
    }

    private CompletableFuture<Void> runToolCalls(Turn turn, List<ToolCall> calls) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ToolCall call : calls) {
            chain = chain.thenCompose(ignored -> runToolCall(call)).thenAccept(outcome -> {
                turn.invocations.add(outcome.invocation);
                ChatMessage toolMessage = ChatMessage.tool(outcome.rendered, call.id());
                turn.transcript.add(toolMessage);
                persist(turn, toolMessage);
            });
        }
        return chain;
    }

    private CompletableFuture<ToolOutcome> runToolCall(ToolCall call) {
        Map<String, Object> arguments;
        try {
            arguments = argumentParser.parse(call);
        } catch (ToolServerException e) {
            LOG.warn("Rejected arguments for tool {}: {}", call.name(), e.getMessage());
            ToolResult result = ToolResult.error(e.kind(), e.getMessage());
            String rendered = renderer.renderError(result.error(), Map.of("originalArguments", call.arguments()));
            return CompletableFuture.completedFuture(
                new ToolOutcome(new ToolInvocation(call.name(), Map.of(), result, Duration.ZERO, 0), rendered));
        }

        CompletableFuture<ToolInvocation> dispatched;
        try {
            dispatched = registry.dispatch(call.name(), arguments);
        } catch (ToolServerException e) {
            LOG.warn("Could not dispatch tool {}: {}", call.name(), e.getMessage());
            dispatched = CompletableFuture.completedFuture(new ToolInvocation(
                call.name(), arguments, ToolResult.error(e.kind(), e.getMessage()), Duration.ZERO, 0));
        }

        return dispatched
            .exceptionally(error -> new ToolInvocation(
                call.name(),
                arguments,
                ToolResult.error(ErrorClassifier.kindOf(error, ErrorClassifier.Phase.CALL), ErrorClassifier.messageOf(error)),
                Duration.ZERO,
                0
            ))
            .thenApply(invocation -> new ToolOutcome(invocation, renderer.render(invocation.result())));
    }

    private List<Map<String, Object>> toolDefinitions() {
        List<Map<String, Object>> definitions = new ArrayList<>();
        for (ToolDescriptor tool : registry.listAllTools().values()) {
            Map<String, Object> parameters = new LinkedHashMap<>(tool.inputSchema());
            parameters.putIfAbsent("type", "object");
            parameters.putIfAbsent("properties", Map.of());

            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.qualifiedName());
            function.put("description", tool.description());
            function.put("parameters", parameters);
            definitions.add(Map.of("type", "function", "function", function));
        }
        return definitions;
    }

    private String partialContent(Turn turn) {
        if (turn.lastAssistantText != null && !turn.lastAssistantText.isBlank()) {
            return turn.lastAssistantText;
        }
        StringBuilder summary = new StringBuilder("Stopped after ")
            .append(turn.rounds)
            .append(" tool rounds without a final answer.");
        for (ToolInvocation invocation : turn.invocations) {
            String output = invocation.result().isError()
                ? "error (" + invocation.errorKind() + "): " + invocation.result().error().message()
                : renderer.render(invocation.result());
            summary.append("\n- ").append(invocation.qualifiedName()).append(": ").append(truncate(output));
        }
        return summary.toString();
    }

    private ChatMessage finish(Turn turn, String content) {
        ChatMessage message = ChatMessage.assistant(content);
        turn.transcript.add(message);
        persist(turn, message);
        return message;
    }

    private Turn openTurn(String sessionId, String systemPrompt) {
        List<ChatMessage> history = new ArrayList<>();
        String resolvedId;
        try {
            Optional<Session> existing = sessionStore.getSession(sessionId);
            Session session = existing.isPresent() ? existing.get() : sessionStore.createSession(systemPrompt);
            resolvedId = session.id();
            history.addAll(session.messages());
        } catch (IOException e) {
            resolvedId = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
            LOG.warn("Session store unavailable, continuing session {} without history: {}", resolvedId, e.getMessage());
        }

        boolean hasSystem = !history.isEmpty() && history.get(0).role() == MessageRole.SYSTEM;
        if (!hasSystem && systemPrompt != null && !systemPrompt.isBlank()) {
            history.add(0, ChatMessage.system(systemPrompt));
        }
        return new Turn(resolvedId, history);
    }

    private void persist(Turn turn, ChatMessage message) {
        try {
            sessionStore.addMessage(turn.sessionId, message);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Failed to persist {} message for session {}: {}", message.role(), turn.sessionId, e.getMessage());
        }
    }

    private static String truncate(String value) {
        if (value.length() <= SUMMARY_OUTPUT_LIMIT) {
            return value;
        }
        return value.substring(0, SUMMARY_OUTPUT_LIMIT) + "...";
    }

    private static final class Turn {
        private final String sessionId;
        private final List<ChatMessage> transcript;
        private final List<ToolInvocation> invocations = new ArrayList<>();
        private int rounds;
        private boolean roundLimitReached;
        private String lastAssistantText;

        private Turn(String sessionId, List<ChatMessage> transcript) {
            this.sessionId = sessionId;
            this.transcript = transcript;
        }
    }

    private record ToolOutcome(ToolInvocation invocation, String rendered) {
    }
}
