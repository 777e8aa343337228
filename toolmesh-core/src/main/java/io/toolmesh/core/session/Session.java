package io.toolmesh.core.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.toolmesh.core.model.ChatMessage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Session(String id, Instant createdAt, Instant updatedAt, List<ChatMessage> messages) {

    public Session {
        Objects.requireNonNull(id, "id must not be null");
        createdAt = createdAt == null ? Instant.now() : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    static Session open(String systemPrompt) {
        Instant now = Instant.now();
        List<ChatMessage> messages = systemPrompt == null || systemPrompt.isBlank()
            ? List.of()
            : List.of(ChatMessage.system(systemPrompt));
        return new Session(UUID.randomUUID().toString(), now, now, messages);
    }

    Session append(ChatMessage message) {
        List<ChatMessage> next = new ArrayList<>(messages);
        next.add(message);
        return new Session(id, createdAt, Instant.now(), next);
    }
}
