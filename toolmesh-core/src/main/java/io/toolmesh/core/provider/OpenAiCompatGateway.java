package io.toolmesh.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolmesh.core.model.ChatMessage;
import io.toolmesh.core.model.MessageRole;
import io.toolmesh.core.model.ToolCall;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OpenAiCompatGateway implements LlmGateway {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatGateway.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Executor DEFAULT_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "toolmesh-llm");
        thread.setDaemon(true);
        return thread;
    });

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;
    private final Executor executor;

    public OpenAiCompatGateway(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, defaultClient(), 3, DEFAULT_EXECUTOR);
    }

    public OpenAiCompatGateway(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        OkHttpClient client,
        int maxAttempts,
        Executor executor
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.client = client == null ? defaultClient() : client;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.executor = executor == null ? DEFAULT_EXECUTOR : executor;
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<LlmCompletion> complete(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return completeBlocking(request);
            } catch (LlmGatewayException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    private LlmCompletion completeBlocking(LlmRequest request) {
        if (apiKey.isBlank()) {
            throw new LlmGatewayException(name, "missing API key for provider " + name);
        }

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(buildRequest(request)).execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = response.body() == null ? "" : response.body().string();
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        LOG.warn("Provider {} returned HTTP {}, retrying in {}ms", name, response.code(), delayMs);
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    throw new LlmGatewayException(
                        name, "HTTP " + response.code() + " " + errorBody, response.code(), null);
                }

                ResponseBody body = response.body();
                if (body == null) {
                    return new LlmCompletion("", List.of(), Map.of());
                }
                String contentType = response.header("Content-Type", "");
                if (contentType.contains("text/event-stream")) {
                    return parseSse(body.source());
                }
                return parseJson(body.string());
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    LOG.warn("Provider {} request failed ({}), retrying in {}ms", name, ioe.getMessage(), delayMs);
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new LlmGatewayException(name, ioe.getMessage(), -1, ioe);
            }
        }
        throw new LlmGatewayException(name, "exhausted retries");
    }

    private Request buildRequest(LlmRequest request) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("stream", false);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.hasTools()) {
            payload.put("tools", request.tools());
            payload.put("tool_choice", request.toolChoice() == null ? "auto" : request.toolChoice());
        }

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json, text/event-stream");
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().name().toLowerCase(Locale.ROOT));
            row.put("content", message.content());
            if (message.role() == MessageRole.ASSISTANT && message.hasToolCalls()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            if (message.role() == MessageRole.TOOL && message.toolCallId() != null && !message.toolCallId().isBlank()) {
                row.put("tool_call_id", message.toolCallId());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", call.arguments().isBlank() ? "{}" : call.arguments());

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id().isBlank() ? "call_" + i : call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private LlmCompletion parseJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode message = root.path("choices").path(0).path("message");
        String content = message.path("content").isNull() ? "" : message.path("content").asText("");
        return new LlmCompletion(content, parseToolCalls(message.path("tool_calls")), usageAsMap(root.path("usage")));
    }

    private LlmCompletion parseSse(BufferedSource source) throws IOException {
        StringBuilder content = new StringBuilder();
        Map<String, ToolCallBuffer> toolBuffers = new LinkedHashMap<>();
        Map<Integer, String> toolIdsByIndex = new LinkedHashMap<>();
        Map<String, Object> usage = Map.of();

        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || !line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }

            JsonNode event = mapper.readTree(payload);
            if (event.has("usage")) {
                usage = usageAsMap(event.path("usage"));
            }
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.has("content") && !delta.path("content").isNull()) {
                    content.append(delta.path("content").asText(""));
                }
                collectToolCalls(delta.path("tool_calls"), toolBuffers, toolIdsByIndex);
            }
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (Map.Entry<String, ToolCallBuffer> entry : toolBuffers.entrySet()) {
            toolCalls.add(new ToolCall(entry.getKey(), entry.getValue().name, entry.getValue().arguments.toString()));
        }
        return new LlmCompletion(content.toString(), toolCalls, usage);
    }

    private List<ToolCall> parseToolCalls(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        int index = 0;
        for (JsonNode item : node) {
            String id = item.path("id").asText("");
            JsonNode function = item.path("function");
            JsonNode argsNode = function.path("arguments");
            String arguments;
            if (argsNode.isTextual()) {
                arguments = argsNode.asText("");
            } else if (argsNode.isMissingNode() || argsNode.isNull()) {
                arguments = "";
            } else {
                arguments = argsNode.toString();
            }
            toolCalls.add(new ToolCall(id.isBlank() ? "call_" + index : id, function.path("name").asText(""), arguments));
            index++;
        }
        return toolCalls;
    }

    private void collectToolCalls(
        JsonNode toolCallsNode,
        Map<String, ToolCallBuffer> buffers,
        Map<Integer, String> toolIdsByIndex
    ) {
        if (toolCallsNode == null || !toolCallsNode.isArray()) {
            return;
        }
        for (JsonNode toolCall : toolCallsNode) {
            int index = toolCall.path("index").asInt(-1);
            String id = toolCall.path("id").asText("");
            if (!id.isBlank() && index >= 0) {
                toolIdsByIndex.put(index, id);
            }
            if (id.isBlank() && index >= 0 && toolIdsByIndex.containsKey(index)) {
                id = toolIdsByIndex.get(index);
            }
            if (id.isBlank()) {
                id = "call_" + Math.max(index, 0);
            }

            ToolCallBuffer buffer = buffers.computeIfAbsent(id, ignored -> new ToolCallBuffer());
            JsonNode function = toolCall.path("function");
            String name = function.path("name").asText("");
            if (!name.isBlank()) {
                buffer.name = name;
            }
            buffer.arguments.append(function.path("arguments").asText(""));
        }
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(usage, MAP_TYPE);
    }

    private static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmGatewayException(name, "interrupted while waiting to retry", -1, ie);
        }
    }

    private static final class ToolCallBuffer {
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();
    }
}
