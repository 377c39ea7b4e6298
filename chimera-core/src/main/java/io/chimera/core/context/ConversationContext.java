package io.chimera.core.context;

import io.chimera.core.model.ChatMessage;
import io.chimera.core.model.MessageRole;
import java.util.ArrayList;
import java.util.List;

/**
 * Provider-neutral prompt for a single turn. History is chronological and never contains the
 * current user message.
 */
public record ConversationContext(
    String systemPrompt,
    String memoryBlock,
    List<ChatMessage> history,
    String userMessage
) {
    public static final String USER_TURN_DELIMITER = "\n\nUser: ";

    public ConversationContext {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        memoryBlock = memoryBlock == null ? "" : memoryBlock;
        history = history == null ? List.of() : List.copyOf(history);
        userMessage = userMessage == null ? "" : userMessage;
    }

    /**
     * Context for the direct prompt entry point: no stored history and no system prompt, with any
     * caller supplied context text carried in the memory block.
     */
    public static ConversationContext forPrompt(String prompt, String contextText) {
        return new ConversationContext("", contextText, List.of(), prompt);
    }

    public boolean hasMemory() {
        return !memoryBlock.isBlank();
    }

    public String systemContent() {
        if (memoryBlock.isBlank()) {
            return systemPrompt;
        }
        if (systemPrompt.isBlank()) {
            return memoryBlock;
        }
        return systemPrompt + "\n\n" + memoryBlock;
    }

    /**
     * System entry (when there is system content), then history, then the current user turn.
     */
    public List<ChatMessage> messages() {
        List<ChatMessage> messages = new ArrayList<>();
        String system = systemContent();
        if (!system.isBlank()) {
            messages.add(ChatMessage.system(system));
        }
        messages.addAll(history);
        messages.add(ChatMessage.user(userMessage));
        return messages;
    }

    /**
     * Messages for APIs without a system role: stored system turns are dropped and the system
     * content is prepended to the first user turn.
     */
    public List<ChatMessage> messagesWithSystemFolded() {
        List<ChatMessage> messages = new ArrayList<>();
        for (ChatMessage message : history) {
            if (message.role() != MessageRole.SYSTEM) {
                messages.add(message);
            }
        }
        messages.add(ChatMessage.user(userMessage));

        String system = systemContent();
        if (system.isBlank()) {
            return messages;
        }
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage message = messages.get(i);
            if (message.role() == MessageRole.USER) {
                messages.set(i, ChatMessage.user(system + USER_TURN_DELIMITER + message.content()));
                break;
            }
        }
        return messages;
    }

    /**
     * Single-string rendering: the memory block followed by the user turn, or the bare message
     * when no memory was injected.
     */
    public String flattenedPrompt() {
        if (!hasMemory()) {
            return userMessage;
        }
        return memoryBlock.strip() + USER_TURN_DELIMITER + userMessage;
    }
}
