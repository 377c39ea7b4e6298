package io.chimera.core.conversation;

import java.util.List;

public record ConversationSnapshot(
    String modelId,
    List<ConversationMessage> messages,
    List<InjectedMemory> injectedMemories
) implements Conversation {

    public ConversationSnapshot {
        modelId = modelId == null ? "" : modelId;
        messages = messages == null ? List.of() : List.copyOf(messages);
        injectedMemories = injectedMemories == null ? List.of() : List.copyOf(injectedMemories);
    }
}
