package io.chimera.core.conversation;

import java.util.List;

/**
 * Read-only view of a stored conversation as handed over by the persistence layer.
 */
public interface Conversation {
    String modelId();

    List<ConversationMessage> messages();

    List<? extends InjectedMemory> injectedMemories();
}
