package io.chimera.core.provider.google;

import io.chimera.core.context.ConversationContext;
import java.io.IOException;

/**
 * One way of reaching the Gemini API. The Google adapter picks a single implementation when it is
 * constructed.
 */
public interface GeminiClient {
    String name();

    GeminiReply generate(String model, ConversationContext context, String apiKey) throws IOException;
}
