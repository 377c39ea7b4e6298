package io.chimera.core.provider;

import io.chimera.core.context.ConversationContext;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Offline stand-in that reflects the caller's message. Serves every identifier the registry does
 * not know.
 */
public final class EchoAdapter implements ProviderAdapter {

    @Override
    public ProviderTag provider() {
        return ProviderTag.ECHO;
    }

    @Override
    public ProviderResponse call(String model, ConversationContext context, String credential) {
        ConversationContext effective = context == null ? ConversationContext.forPrompt("", "") : context;
        String prompt = effective.flattenedPrompt();
        String message = effective.userMessage();

        boolean contextInjected = effective.hasMemory();
        int contextLength = contextInjected ? effective.memoryBlock().strip().length() : 0;

        StringBuilder reply = new StringBuilder()
            .append("[Echo Mode - ").append(model).append("]\n\n");
        if (contextInjected) {
            reply.append("Context received (").append(contextLength).append(" chars)\n\n");
        }
        reply.append("Your message: ").append(message).append("\n\n")
            .append("Response: I received your message")
            .append(contextInjected ? " with injected context" : "")
            .append(". In production, this would be processed by ").append(model).append('.');

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("context_injected", contextInjected);
        metadata.put("context_length", contextLength);
        return ProviderResponse.success(reply.toString(), model, ProviderTag.ECHO, wordCount(prompt), metadata);
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.strip().split("\\s+").length;
    }
}
