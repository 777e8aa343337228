package io.toolmesh.core.session;

import io.toolmesh.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface SessionStore {
    Optional<Session> getSession(String sessionId) throws IOException;

    Session createSession(String systemPrompt) throws IOException;

    void addMessage(String sessionId, ChatMessage message) throws IOException;

    List<ChatMessage> getHistory(String sessionId) throws IOException;
}
