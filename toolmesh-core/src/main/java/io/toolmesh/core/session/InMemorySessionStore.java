package io.toolmesh.core.session;

import io.toolmesh.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySessionStore implements SessionStore {
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<Session> getSession(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Session createSession(String systemPrompt) {
        Session session = Session.open(systemPrompt);
        sessions.put(session.id(), session);
        return session;
    }

    @Override
    public void addMessage(String sessionId, ChatMessage message) {
        Session updated = sessions.computeIfPresent(sessionId, (id, session) -> session.append(message));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown session: " + sessionId);
        }
    }

    @Override
    public List<ChatMessage> getHistory(String sessionId) {
        return getSession(sessionId).map(Session::messages).orElse(List.of());
    }
}
