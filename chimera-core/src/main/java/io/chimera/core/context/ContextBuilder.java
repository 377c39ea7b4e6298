package io.chimera.core.context;

import io.chimera.core.conversation.Conversation;
import io.chimera.core.conversation.ConversationMessage;
import io.chimera.core.conversation.InjectedMemory;
import io.chimera.core.model.ChatMessage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

public final class ContextBuilder {
    public static final String SYSTEM_PROMPT = "You are a helpful AI assistant in the Chimera Protocol system.";
    public static final int HISTORY_LIMIT = 10;

    static final String CONTEXT_HEADER = "=== Injected Context ===";
    static final String CONTEXT_FOOTER = "=== End Context ===";

    public ConversationContext build(Conversation conversation, String userMessage) {
        Objects.requireNonNull(conversation, "conversation must not be null");
        return new ConversationContext(
            SYSTEM_PROMPT,
            renderMemories(conversation.injectedMemories()),
            recentHistory(conversation.messages()),
            userMessage
        );
    }

    String renderMemories(List<? extends InjectedMemory> memories) {
        if (memories == null || memories.isEmpty()) {
            return "";
        }
        StringBuilder block = new StringBuilder();
        for (InjectedMemory memory : memories) {
            if (memory == null || !memory.active()) {
                continue;
            }
            block.append("\n[").append(memory.title()).append("]\n")
                .append(memory.content()).append('\n');
        }
        if (block.length() == 0) {
            return "";
        }
        return CONTEXT_HEADER + "\n" + block + "\n" + CONTEXT_FOOTER;
    }

    List<ChatMessage> recentHistory(List<ConversationMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        // stable sort keeps storage order for equal timestamps
        List<ConversationMessage> ordered = new ArrayList<>(messages);
        ordered.sort(Comparator.comparing(ConversationMessage::timestamp));
        int from = Math.max(0, ordered.size() - HISTORY_LIMIT);

        List<ChatMessage> history = new ArrayList<>(ordered.size() - from);
        for (ConversationMessage message : ordered.subList(from, ordered.size())) {
            history.add(message.toChatMessage());
        }
        return history;
    }
}
