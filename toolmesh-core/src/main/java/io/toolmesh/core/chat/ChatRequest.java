package io.toolmesh.core.chat;

public record ChatRequest(
    String sessionId,
    String message,
    String systemPrompt,
    boolean enableTools,
    boolean includeHistory
) {

    public static ChatRequest of(String message) {
        return new ChatRequest(null, message, null, true, false);
    }

    public static ChatRequest inSession(String sessionId, String message) {
        return new ChatRequest(sessionId, message, null, true, false);
    }

    public ChatRequest withoutTools() {
        return new ChatRequest(sessionId, message, systemPrompt, false, includeHistory);
    }

    public ChatRequest withHistory() {
        return new ChatRequest(sessionId, message, systemPrompt, enableTools, true);
    }
}
