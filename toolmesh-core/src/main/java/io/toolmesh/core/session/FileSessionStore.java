package io.toolmesh.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.toolmesh.core.model.ChatMessage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public final class FileSessionStore implements SessionStore {
    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path directory;
    private final ObjectMapper mapper;

    public FileSessionStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Optional<Session> getSession(String sessionId) throws IOException {
        if (sessionId == null || !SESSION_ID.matcher(sessionId).matches()) {
            return Optional.empty();
        }
        Path path = pathOf(sessionId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(Files.readString(path), Session.class));
    }

    @Override
    public synchronized Session createSession(String systemPrompt) throws IOException {
        Session session = Session.open(systemPrompt);
        save(session);
        return session;
    }

    @Override
    public synchronized void addMessage(String sessionId, ChatMessage message) throws IOException {
        Session session = getSession(sessionId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        save(session.append(message));
    }

    @Override
    public synchronized List<ChatMessage> getHistory(String sessionId) throws IOException {
        return getSession(sessionId).map(Session::messages).orElse(List.of());
    }

    private Path pathOf(String sessionId) {
        return directory.resolve(sessionId + ".json");
    }

    private void save(Session session) throws IOException {
        Files.createDirectories(directory);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(session);
        Files.writeString(pathOf(session.id()), json + System.lineSeparator());
    }
}
