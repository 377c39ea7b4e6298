package io.chimera.core.conversation;

import io.chimera.core.model.ChatMessage;
import io.chimera.core.model.MessageRole;
import java.time.Instant;
import java.util.Objects;

public record ConversationMessage(MessageRole role, String content, Instant timestamp) {

    public ConversationMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        content = content == null ? "" : content;
    }

    public ChatMessage toChatMessage() {
        return new ChatMessage(role, content);
    }
}
